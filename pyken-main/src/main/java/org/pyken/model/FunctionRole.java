package org.pyken.model;

public enum FunctionRole {
    /** Emitted as {@code fn}. */
    HELPER,
    /** Emitted as an Aiken {@code test}. */
    TEST
}
