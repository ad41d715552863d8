package org.pyken.ir;

/**
 * Terminal failure.
 *
 * @param message failure message, or {@code null}
 */
public record Fail(IrNode message) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
