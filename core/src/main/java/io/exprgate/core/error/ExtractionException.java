package io.exprgate.core.error;

/**
 * Abstract parent for errors that stop extraction of an expression. Carries the offending source fragment and
 * its 1-based position so callers can point the author at the problem.
 */
public abstract class ExtractionException extends ExprGateException {

    private static final long serialVersionUID = 1L;

    private final String fragment;
    private final int line;
    private final int column;

    protected ExtractionException(String message, String fragment, int line, int column) {
        super(message, Phase.EXTRACTION);
        this.fragment = fragment;
        this.line = line;
        this.column = column;
    }

    protected ExtractionException(String message, Throwable cause, String fragment, int line, int column) {
        super(message, cause, Phase.EXTRACTION);
        this.fragment = fragment;
        this.line = line;
        this.column = column;
    }

    /** The source text that triggered the error, or {@code null} if the parser did not report one. */
    public String fragment() {
        return fragment;
    }

    /** 1-based line of the error, or {@code 0} if unknown. */
    public int line() {
        return line;
    }

    /** 1-based column of the error, or {@code 0} if unknown. */
    public int column() {
        return column;
    }
}
