package io.exprgate.core.error;

/** Thrown when the underlying tree parser rejects the expression text. */
public final class ExpressionSyntaxException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    public ExpressionSyntaxException(String message, String fragment, int line, int column) {
        super(message, fragment, line, column);
    }

    public ExpressionSyntaxException(String message, Throwable cause, String fragment, int line, int column) {
        super(message, cause, fragment, line, column);
    }
}
