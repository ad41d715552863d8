package org.pyken.ir;

import java.util.List;

/**
 * A function call, or record construction when {@code record} is set.
 */
public record Call(IrNode callee, List<Argument> arguments, boolean record) implements IrNode {

    /**
     * @param label the argument label, or {@code null} for a positional argument
     */
    public record Argument(String label, IrNode value) {

        public static Argument positional(IrNode value) {
            return new Argument(null, value);
        }
    }

    public Call {
        arguments = List.copyOf(arguments);
    }

    public static Call of(IrNode callee, IrNode... arguments) {
        return new Call(callee, List.of(arguments).stream().map(Argument::positional).toList(), false);
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
