package org.pyken;

import org.pyken.diagnostic.Diagnostic;
import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.diagnostic.Severity;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.emitter.AikenEmitter;
import org.pyken.model.TranslationUnit;
import org.pyken.model.TypeMapping;
import org.pyken.model.ValidatorModelBuilder;
import org.pyken.parser.FunctionMetadata;
import org.pyken.parser.SourceAnalyzer;
import org.pyken.parser.SourceModule;
import org.pyken.parser.UnsupportedConstruct;
import org.pyken.translator.StatementTranslator;
import org.pyken.translator.TranslatedFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the compiler: translates Python validator sources to Aiken.
 * <p>
 * {@link #translate} handles a single source text and never throws for
 * problems in the input; they come back as diagnostics. {@link #run} processes
 * a file or a directory tree and writes the artifacts.
 * <p>
 * Instances are stateless and safe to share between threads.
 */
public class PyKen {

    private static final Logger log = LoggerFactory.getLogger(PyKen.class);

    private final TranspilerOptions options;

    public PyKen() {
        this(TranspilerOptions.defaults());
    }

    public PyKen(TranspilerOptions options) {
        this.options = options;
    }

    public TranspilerOptions options() {
        return options;
    }

    /**
     * Run the full pipeline over {@code input}, a {@code .py} file or a directory.
     *
     * @throws IllegalArgumentException if {@code input} does not exist
     * @throws ArtifactWriteException   if the output directory cannot be created
     */
    public TranspileReport run(Path input) {
        return new TranspileRun(this).execute(input);
    }

    /**
     * Translate one source file.
     *
     * @param fileName name used in diagnostics and in the header of the output
     */
    public FileTranslation translate(String fileName, String source) {
        DiagnosticSink sink = new DiagnosticSink(fileName);
        SourceModule module;
        try {
            module = new SourceAnalyzer().analyze(fileName, source);
        } catch (SourceParseException e) {
            log.debug("Parse error in {}: {}", fileName, e.getMessage());
            return FileTranslation.failed(fileName, Diagnostic.of(DiagnosticKind.PARSE_ERROR, fileName,
                    new SourceLocation(e.getLine(), e.getColumn()), null, e.getMessage()));
        }

        TypeMapping types = TypeMapping.forModule(module);
        ValidatorModelBuilder models = new ValidatorModelBuilder(types, sink);
        StatementTranslator translator = new StatementTranslator(module, types, sink);

        List<TranslatedFunction> translated = new ArrayList<>();
        List<String> emitted = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (FunctionMetadata function : module.functions()) {
            if (!function.isSupported()) {
                for (UnsupportedConstruct construct : function.unsupported()) {
                    sink.report(DiagnosticKind.UNSUPPORTED_CONSTRUCT, construct.location(), function.qualifiedName(),
                                "Unsupported construct: " + construct.description());
                }
                excluded.add(function.qualifiedName());
                continue;
            }
            int before = sink.diagnostics().size();
            try {
                TranslationUnit unit = models.build(function);
                TranslatedFunction result = translator.translate(unit);
                if (options.strict() && hasWarningSince(sink, before)) {
                    excluded.add(function.qualifiedName());
                    continue;
                }
                translated.add(result);
                emitted.add(function.qualifiedName());
            } catch (TranslationException e) {
                sink.add(e.getDiagnostic());
                excluded.add(function.qualifiedName());
            } catch (PyKenException e) {
                sink.report(DiagnosticKind.UNSUPPORTED_CONSTRUCT, function.location(), function.qualifiedName(),
                            e.getMessage());
                excluded.add(function.qualifiedName());
            }
        }

        String output = null;
        if (!translated.isEmpty()) {
            output = new AikenEmitter(module, types, sink).emit(translated);
        }
        log.debug("{}: {} emitted, {} excluded", fileName, emitted.size(), excluded.size());

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : sink.diagnostics()) {
            diagnostics.add(options.strict() ? diagnostic.promoted() : diagnostic);
        }
        return new FileTranslation(fileName, output, emitted, excluded, diagnostics);
    }

    private static boolean hasWarningSince(DiagnosticSink sink, int index) {
        List<Diagnostic> diagnostics = sink.diagnostics();
        for (int i = index; i < diagnostics.size(); i++) {
            if (diagnostics.get(i).severity() == Severity.WARNING) {
                return true;
            }
        }
        return false;
    }
}
