package io.exprgate.core.model;

/**
 * 1-based source position of a node inside the expression text as the author wrote it.
 *
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record Position(int line, int column) {

    /** Placeholder for nodes the parser could not locate. */
    public static final Position UNKNOWN = new Position(0, 0);

    public Position {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Position must not be negative, got: " + line + ":" + column);
        }
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? "line " + line + ", column " + column : "unknown position";
    }
}
