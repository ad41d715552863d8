package org.pyken.diagnostic;

import org.pyken.TranslationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the diagnostics of one file. Each worker owns its sink; sinks are
 * never shared between threads. Identical diagnostics are recorded once.
 */
public final class DiagnosticSink {

    private final String file;
    private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

    public DiagnosticSink(String file) {
        this.file = file;
    }

    public String file() {
        return file;
    }

    public Diagnostic report(DiagnosticKind kind, SourceLocation location, String function, String message) {
        Diagnostic diagnostic = Diagnostic.of(kind, file, location, function, message);
        diagnostics.add(diagnostic);
        return diagnostic;
    }

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addAll(Iterable<Diagnostic> others) {
        for (Diagnostic diagnostic : others) {
            diagnostics.add(diagnostic);
        }
    }

    /**
     * Build a fatal diagnostic and wrap it in the exception that aborts the current function.
     */
    public TranslationException fatal(DiagnosticKind kind, SourceLocation location, String function, String message) {
        return new TranslationException(Diagnostic.of(kind, file, location, function, message));
    }

    public boolean hasFatal() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isFatal()) {
                return true;
            }
        }
        return false;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }
}
