package org.pyken.ir;

import java.math.BigInteger;

/**
 * A constant. {@code value} holds the decoded text: digits for integers, the
 * raw characters for strings and byte strings, hex digits for {@link Kind#HEX}.
 */
public record Literal(Kind kind, String value) implements IrNode {

    public enum Kind {
        INT,
        STRING,
        BYTES,
        HEX,
        BOOL,
        NONE,
        VOID
    }

    public static final Literal TRUE = new Literal(Kind.BOOL, "True");
    public static final Literal FALSE = new Literal(Kind.BOOL, "False");
    public static final Literal NONE = new Literal(Kind.NONE, "None");
    public static final Literal VOID = new Literal(Kind.VOID, "Void");

    public static Literal integer(BigInteger value) {
        return new Literal(Kind.INT, value.toString());
    }

    public static Literal string(String value) {
        return new Literal(Kind.STRING, value);
    }

    public static Literal bytes(String value) {
        return new Literal(Kind.BYTES, value);
    }

    public static Literal hex(String digits) {
        return new Literal(Kind.HEX, digits);
    }

    public static Literal bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
