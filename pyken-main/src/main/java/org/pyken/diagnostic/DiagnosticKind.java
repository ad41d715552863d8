package org.pyken.diagnostic;

/**
 * Every problem the pipeline can report, with the severity it is raised at and
 * the smallest unit of output it excludes when fatal.
 */
public enum DiagnosticKind {

    PARSE_ERROR(Severity.FATAL, Scope.FILE),
    UNSUPPORTED_CONSTRUCT(Severity.FATAL, Scope.FUNCTION),
    ARITY_MISMATCH(Severity.FATAL, Scope.FUNCTION),
    UNKNOWN_TYPE(Severity.WARNING, Scope.FUNCTION),
    NON_EXHAUSTIVE_BRANCHES(Severity.FATAL, Scope.FUNCTION),
    REASSIGNMENT_TYPE_CONFLICT(Severity.FATAL, Scope.FUNCTION),
    UNSUPPORTED_OPERATOR(Severity.FATAL, Scope.FUNCTION),
    UNREACHABLE_CODE(Severity.WARNING, Scope.FUNCTION),
    IDENTIFIER_COLLISION(Severity.INFO, Scope.FUNCTION),
    IO_ERROR(Severity.FATAL, Scope.FILE);

    public enum Scope {
        FILE,
        FUNCTION
    }

    private final Severity severity;
    private final Scope scope;

    DiagnosticKind(Severity severity, Scope scope) {
        this.severity = severity;
        this.scope = scope;
    }

    public Severity severity() {
        return severity;
    }

    public Scope scope() {
        return scope;
    }
}
