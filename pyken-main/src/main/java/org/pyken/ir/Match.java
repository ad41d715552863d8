package org.pyken.ir;

import java.util.List;

/**
 * An exhaustive pattern match. A wildcard arm, if any, is always last.
 */
public record Match(IrNode subject, List<Arm> arms) implements IrNode {

    /**
     * @param patterns alternative patterns of the arm; empty for the wildcard
     */
    public record Arm(List<IrNode> patterns, IrNode body) {

        public Arm {
            patterns = List.copyOf(patterns);
        }

        public static Arm wildcard(IrNode body) {
            return new Arm(List.of(), body);
        }

        public boolean isWildcard() {
            return patterns.isEmpty();
        }
    }

    public Match {
        arms = List.copyOf(arms);
        for (int i = 0; i < arms.size() - 1; i++) {
            if (arms.get(i).isWildcard()) {
                throw new IllegalArgumentException("Wildcard arm must be last");
            }
        }
    }

    @Override
    public <R, A> R accept(IrVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }
}
