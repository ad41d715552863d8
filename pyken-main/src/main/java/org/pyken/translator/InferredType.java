package org.pyken.translator;

import java.util.Objects;

/**
 * The coarse static type the translator tracks for local bindings, enough to
 * spot a name being rebound to a value of a different kind.
 */
public final class InferredType {

    public static final InferredType UNKNOWN = new InferredType("?");
    public static final InferredType INT = new InferredType("Int");
    public static final InferredType BOOL = new InferredType("Bool");
    public static final InferredType STRING = new InferredType("String");
    public static final InferredType BYTES = new InferredType("ByteArray");
    public static final InferredType OPTION = new InferredType("Option");
    public static final InferredType LIST = new InferredType("List");

    private static final String TUPLE_SUFFIX = "-tuple";

    private final String name;

    private InferredType(String name) {
        this.name = name;
    }

    public static InferredType tuple(int arity) {
        return new InferredType(arity + TUPLE_SUFFIX);
    }

    public static InferredType named(String name) {
        switch (name) {
            case "Int":
                return INT;
            case "Bool":
                return BOOL;
            case "String":
                return STRING;
            case "ByteArray":
                return BYTES;
            case "Data":
                return UNKNOWN;
            default:
                if (name.startsWith("Option<")) {
                    return OPTION;
                }
                if (name.startsWith("List<")) {
                    return LIST;
                }
                if (name.startsWith("(")) {
                    return tuple(elements(name));
                }
                return new InferredType(name);
        }
    }

    /** Number of elements of a tuple type, or {@code -1} for any other type. */
    public int arity() {
        return name.endsWith(TUPLE_SUFFIX) ? Integer.parseInt(name.substring(0, name.length() - TUPLE_SUFFIX.length())) : -1;
    }

    /** Top-level elements of an Aiken tuple type such as {@code (Int, List<(Int, Int)>)}. */
    private static int elements(String tuple) {
        int depth = 0;
        int count = 1;
        for (int i = 1; i < tuple.length() - 1; i++) {
            char c = tuple.charAt(i);
            if (c == '(' || c == '<') {
                depth++;
            } else if (c == ')' || c == '>') {
                depth--;
            } else if (c == ',' && depth == 0) {
                count++;
            }
        }
        return count;
    }

    public String name() {
        return name;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /** Unknown types are compatible with everything. */
    public boolean isCompatibleWith(InferredType other) {
        return !isKnown() || !other.isKnown() || equals(other);
    }

    /** The common type of two branches: the type itself when both agree, otherwise unknown. */
    public InferredType join(InferredType other) {
        return equals(other) ? this : UNKNOWN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InferredType)) {
            return false;
        }
        return name.equals(((InferredType) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
