package io.exprgate.core.model;

import io.exprgate.core.error.RuleSchemaException;
import java.util.Objects;

/**
 * Schema entry for one datafield. Ids are case-sensitive.
 *
 * @param id   datafield name as it appears in expressions
 * @param kind declared shape
 */
public record DatafieldDecl(String id, DatafieldKind kind) {

    public DatafieldDecl {
        if (id == null || id.isBlank()) {
            throw new RuleSchemaException("Datafield id must not be null or blank");
        }
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static DatafieldDecl matrix(String id) {
        return new DatafieldDecl(id, DatafieldKind.MATRIX);
    }

    public static DatafieldDecl vector(String id) {
        return new DatafieldDecl(id, DatafieldKind.VECTOR);
    }

    public static DatafieldDecl group(String id) {
        return new DatafieldDecl(id, DatafieldKind.GROUP);
    }
}
