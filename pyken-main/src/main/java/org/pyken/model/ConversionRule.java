package org.pyken.model;

/**
 * How a Python type relates to the Aiken type it is mapped to.
 */
public enum ConversionRule {
    /** Same meaning on both sides. */
    IDENTITY,
    /** The Aiken type can represent fewer values, e.g. {@code float} as {@code Int}. */
    NARROWING,
    /** Mapped to untyped {@code Data}. */
    OPAQUE,
    /** A container whose parameters are mapped recursively. */
    GENERIC,
    /** Wrapped in {@code Option}. */
    OPTIONAL
}
