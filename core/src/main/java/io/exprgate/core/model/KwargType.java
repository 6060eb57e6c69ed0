package io.exprgate.core.model;

import io.exprgate.core.error.RuleSchemaException;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Declared type of a keyword argument. Each literal kind is checked against this enumeration exactly once.
 *
 * <p>Widening: an {@code int} literal satisfies {@link #FLOAT}. {@code bool} never satisfies a numeric type.
 */
public enum KwargType {
    BOOL("bool"),
    INT("int"),
    FLOAT("float"),
    STR("str"),
    /** {@code int} or {@code float}. */
    NUMBER("number"),
    /** Any literal. */
    ANY("any");

    private final String id;

    KwargType(String id) {
        this.id = id;
    }

    /** Rule-table spelling of this type. */
    public String id() {
        return id;
    }

    /** Returns {@code true} if a literal of the given kind satisfies this type. */
    public boolean accepts(LiteralKind kind) {
        return switch (this) {
            case BOOL -> kind == LiteralKind.BOOL;
            case INT -> kind == LiteralKind.INT;
            case FLOAT, NUMBER -> kind == LiteralKind.INT || kind == LiteralKind.FLOAT;
            case STR -> kind == LiteralKind.STR;
            case ANY -> true;
        };
    }

    /** Returns {@code true} if values of this type can be range-checked. */
    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == NUMBER;
    }

    /**
     * Resolves a rule-table type name.
     *
     * @throws RuleSchemaException if the name is not one of the known types
     */
    public static KwargType fromId(String id) {
        for (KwargType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new RuleSchemaException("Unknown kwarg type '" + id + "'; expected one of: "
                + Arrays.stream(values()).map(KwargType::id).collect(Collectors.joining(", ")));
    }
}
