package io.exprgate.core.model;

import java.util.List;
import java.util.Objects;

/** One top-level statement of an expression. Sealed: a statement is an assignment or a bare expression. */
public sealed interface Statement permits Statement.Assignment, Statement.Bare {

    Position position();

    /**
     * {@code t1 = t2 = ... = value}. Augmented forms ({@code a += x}) arrive already desugared to {@code a = a +
     * x}.
     *
     * @param targets  assigned names, left to right, never empty
     * @param value    right-hand side
     * @param position position of the first target
     */
    record Assignment(List<String> targets, ExprNode value, Position position) implements Statement {
        public Assignment {
            targets = List.copyOf(targets);
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("Assignment requires at least one target");
            }
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }
    }

    /** A statement that is just an expression. */
    record Bare(ExprNode expression) implements Statement {
        public Bare {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public Position position() {
            return expression.position();
        }
    }
}
