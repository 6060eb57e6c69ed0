package io.exprgate.core.error;

/**
 * Thrown when an operator or datafield table is malformed: unreadable file, structural JSON Schema failure,
 * duplicate ids, inconsistent bounds or unknown type names. Raised at load time only. A {@code RuleSchema} that
 * was built successfully never throws this during validation.
 */
public final class RuleSchemaException extends ExprGateException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public RuleSchemaException(String message) {
        this(message, (String) null);
    }

    public RuleSchemaException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    public RuleSchemaException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null} for in-memory tables. */
    public String source() {
        return source;
    }
}
