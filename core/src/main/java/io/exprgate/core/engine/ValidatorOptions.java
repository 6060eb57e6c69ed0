package io.exprgate.core.engine;

import java.util.Objects;

/**
 * Tunables of {@link ExpressionValidator}.
 *
 * @param vectorPrefix operator-name prefix marking vector-aware functions; VECTOR datafields may only be direct
 *                     arguments of calls whose name starts with it
 */
public record ValidatorOptions(String vectorPrefix) {

    /** Default prefix of vector-aware operators. */
    public static final String DEFAULT_VECTOR_PREFIX = "vec_";

    public ValidatorOptions {
        Objects.requireNonNull(vectorPrefix, "vectorPrefix must not be null");
        if (vectorPrefix.isBlank()) {
            throw new IllegalArgumentException("vectorPrefix must not be blank");
        }
    }

    public static ValidatorOptions defaults() {
        return new ValidatorOptions(DEFAULT_VECTOR_PREFIX);
    }

    public boolean isVectorAware(String operator) {
        return operator.startsWith(vectorPrefix);
    }
}
