package io.exprgate.core.error;

/**
 * Abstract base for all expr-gate exceptions. Never thrown directly. Use {@link RuleSchemaException} for
 * load-time configuration errors or a subclass of {@link ExtractionException} for expressions that could not be
 * analyzed.
 *
 * <p>Rule violations found in a well-formed expression are never exceptions; they are reported through {@code
 * ValidationReport}.
 */
public abstract class ExprGateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXTRACTION
    }

    private final Phase phase;

    protected ExprGateException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ExprGateException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
