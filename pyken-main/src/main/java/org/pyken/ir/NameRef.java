package org.pyken.ir;

/**
 * A reference to a named value.
 *
 * @param name     the Python name; the emitter sanitises {@link Kind#VALUE} and {@link Kind#FUNCTION} names
 * @param typeName the declaring type of a {@link Kind#CONSTRUCTOR}, otherwise {@code null}
 */
public record NameRef(String name, Kind kind, String typeName) implements IrNode {

    public enum Kind {
        /** A parameter or local binding. */
        VALUE,
        /** A top-level function or validator of the same file. */
        FUNCTION,
        /** A data constructor, emitted verbatim. */
        CONSTRUCTOR,
        /** An Aiken module qualifier such as {@code list}. */
        MODULE
    }

    /**
     * Starts the name of a value the translator introduces itself. Such names
     * never come from Python source and give way silently when they collide.
     */
    public static final String SYNTHETIC_PREFIX = "$";

    public static NameRef value(String name) {
        return new NameRef(name, Kind.VALUE, null);
    }

    public static NameRef function(String name) {
        return new NameRef(name, Kind.FUNCTION, null);
    }

    public static NameRef constructor(String name, String typeName) {
        return new NameRef(name, Kind.CONSTRUCTOR, typeName);
    }

    public static NameRef module(String name) {
        return new NameRef(name, Kind.MODULE, null);
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
