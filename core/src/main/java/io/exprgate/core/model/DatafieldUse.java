package io.exprgate.core.model;

import java.util.Objects;

/**
 * One occurrence of a free variable.
 *
 * @param name       the datafield name
 * @param position   source position of the name
 * @param argumentOf index of the call this name is a direct (positional or keyword) argument of, or {@code
 *                   null} when the name sits at top level or inside an operator expression
 */
public record DatafieldUse(String name, Position position, Integer argumentOf) {

    public DatafieldUse {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    public boolean isDirectArgument() {
        return argumentOf != null;
    }
}
