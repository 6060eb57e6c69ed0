package io.exprgate.core.model;

import io.exprgate.core.error.RuleSchemaException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema entry for one operator: positional arity bounds and declared keyword arguments.
 *
 * @param minArgs minimum positional argument count (inclusive)
 * @param maxArgs maximum positional argument count (inclusive), {@link #UNBOUNDED} for no limit
 * @param kwargs  declared keyword arguments by name
 */
public record OperatorRule(int minArgs, int maxArgs, Map<String, KwargRule> kwargs) {

    public static final int UNBOUNDED = -1;

    public OperatorRule {
        if (minArgs < 0) {
            throw new RuleSchemaException("min_args must not be negative, got: " + minArgs);
        }
        if (maxArgs != UNBOUNDED && maxArgs < minArgs) {
            throw new RuleSchemaException("max_args " + maxArgs + " is below min_args " + minArgs
                    + "; use -1 for an unbounded maximum");
        }
        kwargs = kwargs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    /** A rule that accepts any positional count and no keywords. */
    public static OperatorRule unrestricted() {
        return new OperatorRule(0, UNBOUNDED, Map.of());
    }

    public static OperatorRule of(int minArgs, int maxArgs) {
        return new OperatorRule(minArgs, maxArgs, Map.of());
    }

    public boolean isUnbounded() {
        return maxArgs == UNBOUNDED;
    }

    /** Returns {@code true} if {@code count} positional arguments (or operands) satisfy the bounds. */
    public boolean acceptsArity(int count) {
        return count >= minArgs && (isUnbounded() || count <= maxArgs);
    }

    public Optional<KwargRule> kwarg(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(kwargs.get(name));
    }

    /** Human-readable arity bounds, e.g. {@code 1..2} or {@code >= 1}. */
    public String describeArity() {
        if (isUnbounded()) {
            return ">= " + minArgs;
        }
        return minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + ".." + maxArgs;
    }
}
