package org.pyken.ir;

/**
 * @param operator Aiken spelling of the operator
 */
public record BinaryOp(String operator, IrNode left, IrNode right) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
