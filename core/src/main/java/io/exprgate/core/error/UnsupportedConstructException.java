package io.exprgate.core.error;

/**
 * Thrown when a syntactically valid expression contains a construct outside the supported grammar subset
 * (control flow, lambdas, subscripts, field access, bitwise operators, ...). Such constructs are rejected rather
 * than skipped so that nothing unvetted reaches evaluation.
 */
public final class UnsupportedConstructException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    public UnsupportedConstructException(String message, String fragment, int line, int column) {
        super(message, fragment, line, column);
    }
}
