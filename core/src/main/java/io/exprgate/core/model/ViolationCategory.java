package io.exprgate.core.model;

/**
 * Rule category of a {@link Violation}. Declaration order is the order in which categories appear in a
 * {@link ValidationReport}.
 */
public enum ViolationCategory {
    UNKNOWN_OPERATOR("unknown_operator"),
    UNKNOWN_DATAFIELD("unknown_datafield"),
    ARITY("arity"),
    UNKNOWN_KWARG("unknown_kwarg"),
    DUPLICATE_KWARG("duplicate_kwarg"),
    KWARG_TYPE("kwarg_type"),
    KWARG_RANGE("kwarg_range"),
    KWARG_ALLOWED("kwarg_allowed"),
    VECTOR_SCOPE("vector_scope");

    private final String code;

    ViolationCategory(String code) {
        this.code = code;
    }

    /** Stable snake_case identifier. */
    public String code() {
        return code;
    }
}
