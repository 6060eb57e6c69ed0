package io.exprgate.core.spi;

import io.exprgate.core.model.ParsedExpression;

/**
 * Pluggable parser SPI. Implementations turn expression text into the closed {@link
 * io.exprgate.core.model.ExprNode} tree using an off-the-shelf parser; the extractor only ever interprets the
 * resulting tree.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionTreeParser {

    /**
     * Returns the parser identifier, e.g. {@code "javaparser"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Parses statement-separated expression text.
     *
     * @param text the expression source, statements separated by {@code ;}
     * @return the parsed statements in source order, empty for blank text
     * @throws io.exprgate.core.error.ExpressionSyntaxException     if the text is not syntactically valid
     * @throws io.exprgate.core.error.UnsupportedConstructException if the text uses a construct outside the
     *     supported grammar subset
     */
    ParsedExpression parse(String text);
}
