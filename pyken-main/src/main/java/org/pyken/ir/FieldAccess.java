package org.pyken.ir;

public record FieldAccess(IrNode target, String field) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
