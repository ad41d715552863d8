package org.pyken.parser;

import org.pyken.PyKenException;
import org.pyken.diagnostic.SourceLocation;

/**
 * Raised while building the syntax tree when a construct lies outside the
 * supported subset. Caught at statement level and recorded on the function.
 */
final class UnsupportedConstructException extends PyKenException {

    private final UnsupportedConstruct construct;

    UnsupportedConstructException(String description, SourceLocation location) {
        super(description + " is not supported");
        this.construct = new UnsupportedConstruct(description, location);
    }

    UnsupportedConstruct construct() {
        return construct;
    }
}
