package io.exprgate.core.model;

import java.util.Objects;

/**
 * A single failed rule check.
 *
 * @param category  rule category
 * @param subject   operator token or datafield name the violation is about
 * @param callIndex index of the offending call site, or {@code null}
 * @param detail    human-readable explanation
 * @param position  where in the expression, {@link Position#UNKNOWN} if not located
 */
public record Violation(
        ViolationCategory category, String subject, Integer callIndex, String detail, Position position) {

    public Violation {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
        position = position != null ? position : Position.UNKNOWN;
    }

    /** Renders {@code [category] detail (at line L, column C)}. */
    public String message() {
        String where = position.isKnown() ? " (at " + position + ")" : "";
        return "[" + category.code() + "] " + detail + where;
    }
}
