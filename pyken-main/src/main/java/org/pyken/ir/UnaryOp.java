package org.pyken.ir;

public record UnaryOp(String operator, IrNode operand) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
