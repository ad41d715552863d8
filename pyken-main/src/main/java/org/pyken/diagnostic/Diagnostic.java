package org.pyken.diagnostic;

import java.util.Comparator;

/**
 * A single problem found while translating one file.
 *
 * @param function name of the function the diagnostic is scoped to, or {@code null} for file-scoped problems
 */
public record Diagnostic(Severity severity,
                         DiagnosticKind kind,
                         String file,
                         SourceLocation location,
                         String function,
                         String message) {

    /**
     * Run-wide reporting order: file path, then position, then kind and message so
     * that diagnostics at the same position still sort stably.
     */
    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::file, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(Diagnostic::location)
            .thenComparing(Diagnostic::kind)
            .thenComparing(Diagnostic::message);

    public static Diagnostic of(DiagnosticKind kind, String file, SourceLocation location, String function, String message) {
        return new Diagnostic(kind.severity(), kind, file, location, function, message);
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    /**
     * Strict mode turns warnings into fatal diagnostics. Informational ones are left alone.
     */
    public Diagnostic promoted() {
        if (severity != Severity.WARNING) {
            return this;
        }
        return new Diagnostic(Severity.FATAL, kind, file, location, function, message);
    }

    public int line() {
        return location.line();
    }

    public int column() {
        return location.column();
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(file).append(':').append(location).append(": ")
          .append(severity.name().toLowerCase()).append(' ')
          .append(kind.name());
        if (function != null) {
            sb.append(" in ").append(function);
        }
        return sb.append(": ").append(message).toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
