package org.pyken;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pyken.diagnostic.Diagnostic;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The merged result of a run: one entry per input file plus every diagnostic,
 * sorted by file, line, column, kind and message.
 */
public final class TranspileReport {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param artifact artifact path relative to the output directory, or {@code null} when nothing was written
     */
    public record FileResult(String file, String artifact, List<String> emitted, List<String> excluded) {

        public FileResult {
            emitted = List.copyOf(emitted);
            excluded = List.copyOf(excluded);
        }
    }

    private final List<FileResult> files;
    private final List<Diagnostic> diagnostics;

    public TranspileReport(List<FileResult> files, List<Diagnostic> diagnostics) {
        this.files = List.copyOf(files);
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(Diagnostic.ORDER);
        this.diagnostics = List.copyOf(sorted);
    }

    static TranspileReport of(List<FileTranslation> translations, Map<String, String> artifacts) {
        List<FileResult> files = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (FileTranslation translation : translations) {
            boolean written = translation.hasOutput() && translation.diagnostics().stream()
                    .noneMatch(d -> d.kind() == DiagnosticKind.IO_ERROR);
            files.add(new FileResult(translation.fileName(),
                                     written ? artifacts.get(translation.fileName()) : null,
                                     translation.emitted(), translation.excluded()));
            diagnostics.addAll(translation.diagnostics());
        }
        return new TranspileReport(files, diagnostics);
    }

    public List<FileResult> files() {
        return files;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public int filesProcessed() {
        return files.size();
    }

    public int artifactsWritten() {
        return (int) files.stream().filter(f -> f.artifact() != null).count();
    }

    public int functionsEmitted() {
        return files.stream().mapToInt(f -> f.emitted().size()).sum();
    }

    public int functionsExcluded() {
        return files.stream().mapToInt(f -> f.excluded().size()).sum();
    }

    public int fatalCount() {
        return count(Severity.FATAL);
    }

    public int warningCount() {
        return count(Severity.WARNING);
    }

    public int infoCount() {
        return count(Severity.INFO);
    }

    private int count(Severity severity) {
        return (int) diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    /** 0 when nothing fatal was reported, 1 otherwise. */
    public int exitCode() {
        return fatalCount() > 0 ? 1 : 0;
    }

    public String toJson() {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode summary = root.putObject("summary");
        summary.put("files", filesProcessed());
        summary.put("artifacts", artifactsWritten());
        summary.put("emitted", functionsEmitted());
        summary.put("excluded", functionsExcluded());
        summary.put("fatal", fatalCount());
        summary.put("warnings", warningCount());
        summary.put("info", infoCount());
        summary.put("exitCode", exitCode());

        ArrayNode fileNodes = root.putArray("files");
        for (FileResult file : files) {
            ObjectNode node = fileNodes.addObject();
            node.put("file", file.file());
            node.put("artifact", file.artifact());
            file.emitted().forEach(node.putArray("emitted")::add);
            file.excluded().forEach(node.putArray("excluded")::add);
        }

        ArrayNode diagnosticNodes = root.putArray("diagnostics");
        for (Diagnostic diagnostic : diagnostics) {
            ObjectNode node = diagnosticNodes.addObject();
            node.put("file", diagnostic.file());
            node.put("line", diagnostic.line());
            node.put("column", diagnostic.column());
            node.put("severity", diagnostic.severity().name());
            node.put("kind", diagnostic.kind().name());
            node.put("function", diagnostic.function());
            node.put("message", diagnostic.message());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new PyKenException("Cannot serialise report", e);
        }
    }
}
