package org.pyken.ir;

/**
 * Evaluates {@code continuation} when {@code condition} holds and fails otherwise.
 *
 * @param message failure message, or {@code null}
 */
public record Guard(IrNode condition, IrNode message, IrNode continuation) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
