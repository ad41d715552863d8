package org.pyken.ir;

import java.util.List;

public record TupleLiteral(List<IrNode> elements) implements IrNode {

    public TupleLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
