package io.exprgate.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits expression text into statements on {@code ;} before any parsing happens.
 *
 * <p>Besides splitting it applies the source-level conventions of the expression language:
 * <ul>
 * <li>everything from the first {@code -->} outside a string or comment is a free-form annotation and is
 * dropped;</li>
 * <li>single-quoted strings are rewritten as double-quoted ones, so {@code 'abc'} reaches the parser as a string
 * literal;</li>
 * <li>inside strings, a backslash that does not start a Java escape is kept literally, so {@code 'a\d'} is the
 * three characters {@code a\d};</li>
 * <li>the word operators {@code and}, {@code or} and {@code not} are rewritten to {@code &&}, {@code ||} and
 * {@code !}, padded to the same width so positions do not move.</li>
 * </ul>
 * Separators inside string literals and comments do not split. Segments that hold only whitespace or comments
 * are discarded.
 */
final class StatementSplitter {

    /** Annotation marker; the rest of the text is ignored. */
    static final String ANNOTATION_MARKER = "-->";

    /** Word operators and their same-width symbolic replacements. */
    static final Map<String, String> WORD_OPERATORS = Map.of("and", "&& ", "or", "||", "not", "!  ");

    /** Characters that may follow a backslash in a Java string literal. */
    private static final String JAVA_ESCAPES = "btnfr\"'\\01234567u";

    /**
     * One statement's text and the 1-based position of its first character in the original text.
     */
    record Segment(String text, int line, int column) {}

    private enum State {
        CODE,
        DOUBLE_QUOTED,
        SINGLE_QUOTED,
        LINE_COMMENT,
        BLOCK_COMMENT
    }

    private StatementSplitter() {
        // utility class
    }

    static List<Segment> split(String source) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        State state = State.CODE;
        boolean hasCode = false;
        int line = 1;
        int column = 1;
        int segmentLine = 1;
        int segmentColumn = 1;

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            char next = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
            int consumed = 1;

            switch (state) {
                case CODE -> {
                    if (source.startsWith(ANNOTATION_MARKER, i)) {
                        i = source.length();
                        continue;
                    }
                    if (c == ';') {
                        if (hasCode) {
                            segments.add(new Segment(current.toString(), segmentLine, segmentColumn));
                        }
                        current.setLength(0);
                        hasCode = false;
                    } else if (c == '"') {
                        current.append(c);
                        hasCode = true;
                        state = State.DOUBLE_QUOTED;
                    } else if (c == '\'') {
                        current.append('"');
                        hasCode = true;
                        state = State.SINGLE_QUOTED;
                    } else if (c == '/' && next == '/') {
                        current.append(c).append(next);
                        consumed = 2;
                        state = State.LINE_COMMENT;
                    } else if (c == '/' && next == '*') {
                        current.append(c).append(next);
                        consumed = 2;
                        state = State.BLOCK_COMMENT;
                    } else if (Character.isJavaIdentifierStart(c)) {
                        int end = i + 1;
                        while (end < source.length() && Character.isJavaIdentifierPart(source.charAt(end))) {
                            end++;
                        }
                        String word = source.substring(i, end);
                        current.append(WORD_OPERATORS.getOrDefault(word, word));
                        consumed = end - i;
                        hasCode = true;
                    } else {
                        current.append(c);
                        hasCode |= !Character.isWhitespace(c);
                    }
                }
                case DOUBLE_QUOTED -> {
                    if (c == '\\' && next != '\0') {
                        appendEscape(current, next);
                        consumed = 2;
                    } else {
                        current.append(c);
                        if (c == '"') {
                            state = State.CODE;
                        }
                    }
                }
                case SINGLE_QUOTED -> {
                    if (c == '\\' && next != '\0') {
                        appendEscape(current, next);
                        consumed = 2;
                    } else if (c == '"') {
                        current.append("\\\"");
                    } else if (c == '\'') {
                        current.append('"');
                        state = State.CODE;
                    } else {
                        current.append(c);
                    }
                }
                case LINE_COMMENT -> {
                    current.append(c);
                    if (c == '\n') {
                        state = State.CODE;
                    }
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        current.append(c).append(next);
                        consumed = 2;
                        state = State.CODE;
                    } else {
                        current.append(c);
                    }
                }
            }

            for (int k = 0; k < consumed; k++) {
                if (source.charAt(i + k) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
            if (c == ';' && state == State.CODE) {
                segmentLine = line;
                segmentColumn = column;
            }
            i += consumed;
        }

        if (hasCode) {
            segments.add(new Segment(current.toString(), segmentLine, segmentColumn));
        }
        return segments;
    }

    private static void appendEscape(StringBuilder current, char escaped) {
        current.append('\\');
        if (JAVA_ESCAPES.indexOf(escaped) < 0) {
            current.append('\\');
        }
        current.append(escaped);
    }
}
