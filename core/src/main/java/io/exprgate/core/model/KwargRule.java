package io.exprgate.core.model;

import io.exprgate.core.error.RuleSchemaException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Constraints on one keyword argument of an operator.
 *
 * <p>{@code allowed} holds {@link Boolean}, {@link Long}, {@link Double} or {@link String} values; an empty list
 * means no enumeration. When both {@code allowed} and bounds are declared, a value must satisfy both.
 *
 * @param type         declared literal type
 * @param allowed      permitted values, empty when unrestricted (elements are never null)
 * @param minVal       lower bound, or {@code null}
 * @param maxVal       upper bound, or {@code null}
 * @param minInclusive whether {@code minVal} itself is permitted
 * @param maxInclusive whether {@code maxVal} itself is permitted
 */
public record KwargRule(
        KwargType type,
        List<Object> allowed,
        Double minVal,
        Double maxVal,
        boolean minInclusive,
        boolean maxInclusive) {

    public KwargRule {
        Objects.requireNonNull(type, "type must not be null");
        allowed = allowed == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(allowed));
        for (Object value : allowed) {
            LiteralKind kind = kindOf(value);
            if (kind == null || !type.accepts(kind)) {
                throw new RuleSchemaException(
                        "Allowed value " + value + " does not match declared kwarg type '" + type.id() + "'");
            }
        }
        if ((minVal != null || maxVal != null) && !type.isNumeric() && type != KwargType.ANY) {
            throw new RuleSchemaException("min_val/max_val require a numeric kwarg type, got '" + type.id() + "'");
        }
        if (minVal != null && maxVal != null && minVal > maxVal) {
            throw new RuleSchemaException("min_val " + minVal + " exceeds max_val " + maxVal);
        }
    }

    /** A rule that only checks the type. */
    public static KwargRule of(KwargType type) {
        return new KwargRule(type, List.of(), null, null, true, true);
    }

    /** A numeric rule with inclusive bounds. */
    public static KwargRule range(KwargType type, Double minVal, Double maxVal) {
        return new KwargRule(type, List.of(), minVal, maxVal, true, true);
    }

    /** An enumerated rule. */
    public static KwargRule oneOf(KwargType type, List<?> allowed) {
        return new KwargRule(type, new ArrayList<>(allowed), null, null, true, true);
    }

    public boolean hasBounds() {
        return minVal != null || maxVal != null;
    }

    public boolean hasAllowed() {
        return !allowed.isEmpty();
    }

    /** Returns {@code true} if {@code value} lies inside the declared bounds. */
    public boolean inRange(double value) {
        if (minVal != null && (minInclusive ? value < minVal : value <= minVal)) {
            return false;
        }
        return maxVal == null || (maxInclusive ? value <= maxVal : value < maxVal);
    }

    /**
     * Returns {@code true} if the literal value is one of {@link #allowed()}. Numbers compare by numeric value, so
     * {@code 3} matches an allowed {@code 3.0}.
     */
    public boolean permits(Object value) {
        for (Object candidate : allowed) {
            if (candidate instanceof Boolean || value instanceof Boolean) {
                if (candidate.equals(value)) {
                    return true;
                }
            } else if (candidate instanceof Number c && value instanceof Number v) {
                if (Double.compare(c.doubleValue(), v.doubleValue()) == 0) {
                    return true;
                }
            } else if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /** Human-readable bound description, e.g. {@code [0.0, 1.0)}. */
    public String describeBounds() {
        return (minVal == null ? "(-inf" : (minInclusive ? "[" : "(") + minVal)
                + ", "
                + (maxVal == null ? "+inf)" : maxVal + (maxInclusive ? "]" : ")"));
    }

    private static LiteralKind kindOf(Object value) {
        if (value instanceof Boolean) {
            return LiteralKind.BOOL;
        }
        if (value instanceof Long || value instanceof Integer) {
            return LiteralKind.INT;
        }
        if (value instanceof Double || value instanceof Float) {
            return LiteralKind.FLOAT;
        }
        if (value instanceof String) {
            return LiteralKind.STR;
        }
        return null;
    }
}
