package org.pyken.ir;

/**
 * Binds {@code value} to {@code name} for the evaluation of {@code body}.
 *
 * @param type Aiken type annotation, or {@code null}
 */
public record Let(String name, String type, IrNode value, IrNode body) implements IrNode {

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
