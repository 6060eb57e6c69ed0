package io.exprgate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of an {@link io.exprgate.core.spi.ExpressionTreeParser}: the original text and its statements in source
 * order. Immutable.
 */
public record ParsedExpression(String source, List<Statement> statements) {

    public ParsedExpression {
        Objects.requireNonNull(source, "source must not be null");
        statements = List.copyOf(statements);
    }

    public static ParsedExpression empty(String source) {
        return new ParsedExpression(source, List.of());
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
