package org.pyken.ir;

public record Conditional(IrNode condition, IrNode then, IrNode otherwise) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
