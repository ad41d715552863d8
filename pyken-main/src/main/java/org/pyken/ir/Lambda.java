package org.pyken.ir;

import java.util.List;

/**
 * An anonymous function, {@code fn(a, b) { body }}.
 *
 * @param parameters Python names of the parameters, in order
 */
public record Lambda(List<String> parameters, IrNode body) implements IrNode {

    public Lambda {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
