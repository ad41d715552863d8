package org.pyken;

import org.pyken.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * The outcome of translating one source file.
 *
 * @param fileName    path of the source relative to the scanned root, with {@code /} separators
 * @param output      Aiken module text, or {@code null} when no function survived
 * @param emitted     qualified names of the functions in {@code output}, in source order
 * @param excluded    qualified names of the functions dropped by a fatal diagnostic
 * @param diagnostics everything reported for the file, in reporting order
 */
public record FileTranslation(String fileName,
                              String output,
                              List<String> emitted,
                              List<String> excluded,
                              List<Diagnostic> diagnostics) {

    public FileTranslation {
        emitted = List.copyOf(emitted);
        excluded = List.copyOf(excluded);
        diagnostics = List.copyOf(diagnostics);
    }

    static FileTranslation failed(String fileName, Diagnostic diagnostic) {
        return new FileTranslation(fileName, null, List.of(), List.of(), List.of(diagnostic));
    }

    public boolean hasOutput() {
        return output != null;
    }

    public boolean hasFatal() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    FileTranslation withDiagnostic(Diagnostic diagnostic) {
        List<Diagnostic> all = new ArrayList<>(diagnostics);
        all.add(diagnostic);
        return new FileTranslation(fileName, output, emitted, excluded, all);
    }
}
