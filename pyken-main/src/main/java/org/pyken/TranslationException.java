package org.pyken;

import org.pyken.diagnostic.Diagnostic;

/**
 * Aborts the translation of a single function. The carried diagnostic is
 * always fatal and names the function it excludes from the artifact.
 */
public class TranslationException extends PyKenException {

    private final Diagnostic diagnostic;

    public TranslationException(Diagnostic diagnostic) {
        super(diagnostic.message());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
