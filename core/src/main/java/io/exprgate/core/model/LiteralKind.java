package io.exprgate.core.model;

import java.util.Locale;

/** Runtime kind of a literal value in an expression. */
public enum LiteralKind {
    BOOL,
    INT,
    FLOAT,
    STR,
    NULL;

    /** Lowercase name used in violation messages, matching the rule-table type names. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
