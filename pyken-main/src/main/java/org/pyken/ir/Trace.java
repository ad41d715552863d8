package org.pyken.ir;

import java.util.List;

/**
 * Emits a trace before evaluating {@code continuation}.
 */
public record Trace(IrNode label, List<IrNode> arguments, IrNode continuation) implements IrNode {

    public Trace {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
