package org.pyken.ir;

/**
 * The value a branch produces, from a {@code return} in tail position.
 */
public record TailValue(IrNode value) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
