package io.exprgate.core.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating one expression. Violations are ordered by {@link ViolationCategory} declaration order,
 * then by first appearance in the expression. An empty report means the expression is fully valid.
 *
 * <p>Immutable value; two reports with the same violations are equal.
 */
public record ValidationReport(List<Violation> violations) {

    public ValidationReport {
        violations = List.copyOf(violations);
    }

    public static ValidationReport valid() {
        return new ValidationReport(List.of());
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public int size() {
        return violations.size();
    }

    public List<Violation> byCategory(ViolationCategory category) {
        return violations.stream().filter(v -> v.category() == category).collect(Collectors.toList());
    }

    public boolean has(ViolationCategory category) {
        return violations.stream().anyMatch(v -> v.category() == category);
    }

    /** One rendered line per violation, in report order. */
    public List<String> messages() {
        return violations.stream().map(Violation::message).collect(Collectors.toList());
    }
}
