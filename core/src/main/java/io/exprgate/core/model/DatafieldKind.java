package io.exprgate.core.model;

import io.exprgate.core.error.RuleSchemaException;

/** Shape of an external data source. Only {@link #VECTOR} restricts which operators may consume it. */
public enum DatafieldKind {
    MATRIX,
    VECTOR,
    GROUP;

    /**
     * Resolves a datafield-table type name (case-sensitive, upper case).
     *
     * @throws RuleSchemaException if the name is not a known kind
     */
    public static DatafieldKind fromId(String id) {
        for (DatafieldKind kind : values()) {
            if (kind.name().equals(id)) {
                return kind;
            }
        }
        throw new RuleSchemaException("Unknown datafield type '" + id + "'; expected one of: MATRIX, VECTOR, GROUP");
    }
}
