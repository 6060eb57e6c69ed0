package io.exprgate.core.model;

import java.util.Objects;

/**
 * One occurrence of an operator token in an expression.
 *
 * @param token     the literal token, e.g. {@code "ts_mean"} or {@code "+"}
 * @param kind      syntactic family
 * @param arity     positional argument count for calls, operand count otherwise
 * @param callIndex index of the matching {@link CallSite} for calls, {@code null} otherwise
 * @param position  source position of the operator's expression
 */
public record OperatorUse(String token, OperatorKind kind, int arity, Integer callIndex, Position position) {

    public OperatorUse {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(position, "position must not be null");
        if (kind == OperatorKind.CALL && callIndex == null) {
            throw new IllegalArgumentException("Call operator use requires a call index: " + token);
        }
    }

    public boolean isCall() {
        return kind == OperatorKind.CALL;
    }
}
