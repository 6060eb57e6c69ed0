package io.exprgate.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.exprgate.core.error.ExpressionSyntaxException;
import io.exprgate.core.error.ExtractionException;
import io.exprgate.core.error.UnsupportedConstructException;
import io.exprgate.core.model.ExprNode;
import io.exprgate.core.model.LiteralKind;
import io.exprgate.core.model.ParsedExpression;
import io.exprgate.core.model.Position;
import io.exprgate.core.model.Statement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("JavaParserTreeParser")
class JavaParserTreeParserTest {

    private final JavaParserTreeParser parser = new JavaParserTreeParser();

    private ExprNode bare(String text) {
        ParsedExpression parsed = parser.parse(text);
        assertThat(parsed.statements()).hasSize(1);
        assertThat(parsed.statements().get(0)).isInstanceOf(Statement.Bare.class);
        return ((Statement.Bare) parsed.statements().get(0)).expression();
    }

    @Test
    @DisplayName("identifies itself as javaparser")
    void parserId() {
        assertThat(parser.id()).isEqualTo("javaparser");
    }

    @Test
    @DisplayName("blank text parses to an empty expression")
    void blankText() {
        ParsedExpression parsed = parser.parse("   ");

        assertThat(parsed.isEmpty()).isTrue();
        assertThat(parsed.source()).isEqualTo("   ");
    }

    @Nested
    @DisplayName("calls")
    class Calls {

        @Test
        @DisplayName("positional and keyword arguments are separated")
        void keywordArguments() {
            ExprNode node = bare("hump(ts_mean(close, 5), hump=0.5)");

            assertThat(node).isInstanceOf(ExprNode.Call.class);
            ExprNode.Call call = (ExprNode.Call) node;
            assertThat(call.function()).isEqualTo("hump");
            assertThat(call.args()).hasSize(1);
            assertThat(call.args().get(0)).isInstanceOf(ExprNode.Call.class);
            assertThat(call.keywords()).hasSize(1);
            assertThat(call.keywords().get(0).name()).isEqualTo("hump");
            assertThat(call.keywords().get(0).value())
                    .isEqualTo(ExprNode.Literal.ofFloat(0.5, new Position(1, 30)));
        }

        @Test
        @DisplayName("repeated keywords are all kept in source order")
        void repeatedKeywords() {
            ExprNode.Call call = (ExprNode.Call) bare("normalize(x, useStd=true, useStd=false)");

            assertThat(call.keywords()).extracting(ExprNode.Keyword::name).containsExactly("useStd", "useStd");
        }

        @Test
        @DisplayName("a positional argument after a keyword is rejected")
        void positionalAfterKeyword() {
            assertThatThrownBy(() -> parser.parse("hump(hump=0.5, x)"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("positional argument after a keyword argument");
        }

        @Test
        @DisplayName("method calls on a target are rejected")
        void scopedCall() {
            assertThatThrownBy(() -> parser.parse("close.shift(1)"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("method call on a target");
        }
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @Test
        @DisplayName("arithmetic maps to Binary, comparison to Compare")
        void arithmeticAndComparison() {
            ExprNode node = bare("close - open > 0");

            assertThat(node).isInstanceOf(ExprNode.Compare.class);
            ExprNode.Compare compare = (ExprNode.Compare) node;
            assertThat(compare.operator()).isEqualTo(">");
            assertThat(compare.left()).isInstanceOf(ExprNode.Binary.class);
            assertThat(((ExprNode.Binary) compare.left()).operator()).isEqualTo("-");
        }

        @Test
        @DisplayName("same-operator boolean chains are flattened")
        void booleanChainFlattened() {
            ExprNode node = bare("a > 0 && b > 0 && c > 0");

            assertThat(node).isInstanceOf(ExprNode.BoolOp.class);
            assertThat(((ExprNode.BoolOp) node).operator()).isEqualTo("&&");
            assertThat(((ExprNode.BoolOp) node).operands()).hasSize(3);
        }

        @Test
        @DisplayName("mixed boolean operators keep precedence")
        void mixedBooleanOperators() {
            ExprNode.BoolOp node = (ExprNode.BoolOp) bare("a && b || c");

            assertThat(node.operator()).isEqualTo("||");
            assertThat(node.operands()).hasSize(2);
            assertThat(node.operands().get(0)).isInstanceOf(ExprNode.BoolOp.class);
        }

        @Test
        @DisplayName("and, or and not are spellings of &&, || and !")
        void wordOperators() {
            ExprNode.BoolOp node = (ExprNode.BoolOp) bare("ts_sum(y, 10) > 100 and not close < open or x");

            assertThat(node.operator()).isEqualTo("||");
            ExprNode.BoolOp and = (ExprNode.BoolOp) node.operands().get(0);
            assertThat(and.operator()).isEqualTo("&&");
            assertThat(and.operands()).hasSize(2);
            assertThat(node.operands().get(1)).isEqualTo(new ExprNode.Name("x", new Position(1, 45)));
        }

        @Test
        @DisplayName("negation of a name stays a unary node")
        void unaryMinusOnName() {
            ExprNode node = bare("-close");

            assertThat(node).isEqualTo(new ExprNode.Unary("-", new ExprNode.Name("close", new Position(1, 2)),
                    new Position(1, 1)));
        }

        @Test
        @DisplayName("logical not maps to a unary node")
        void logicalNot() {
            ExprNode node = bare("!(close > open)");

            assertThat(node).isInstanceOf(ExprNode.Unary.class);
            assertThat(((ExprNode.Unary) node).operator()).isEqualTo("!");
            assertThat(((ExprNode.Unary) node).operand()).isInstanceOf(ExprNode.Compare.class);
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"a & b", "a | b", "a ^ b", "a << 2", "~a", "a++", "a ? b : c"})
        @DisplayName("bitwise, increment and conditional operators are rejected")
        void unsupportedOperators(String text) {
            assertThatThrownBy(() -> parser.parse(text)).isInstanceOf(UnsupportedConstructException.class);
        }
    }

    @Nested
    @DisplayName("literals")
    class Literals {

        @Test
        @DisplayName("a sign on a numeric literal is folded into the literal")
        void signFolded() {
            ExprNode node = bare("-5");

            assertThat(node).isInstanceOf(ExprNode.Literal.class);
            assertThat(((ExprNode.Literal) node).kind()).isEqualTo(LiteralKind.INT);
            assertThat(((ExprNode.Literal) node).value()).isEqualTo(-5L);
        }

        @Test
        @DisplayName("negative float literal")
        void negativeFloat() {
            ExprNode.Literal literal = (ExprNode.Literal) bare("-0.25");

            assertThat(literal.kind()).isEqualTo(LiteralKind.FLOAT);
            assertThat(literal.value()).isEqualTo(-0.25);
        }

        @Test
        @DisplayName("a backslash that is not a Java escape is kept literally")
        void unknownEscapeKept() {
            Statement.Assignment statement = (Statement.Assignment) parser.parse("x = 'a\\d'").statements().get(0);

            assertThat(((ExprNode.Literal) statement.value()).value()).isEqualTo("a\\d");
        }

        @Test
        @DisplayName("Java escapes keep their meaning")
        void knownEscapeDecoded() {
            assertThat(((ExprNode.Literal) bare("'a\\tb'")).value()).isEqualTo("a\tb");
        }

        @Test
        @DisplayName("hex literals keep their numeric value")
        void hexLiteral() {
            assertThat(((ExprNode.Literal) bare("0x10")).value()).isEqualTo(16L);
        }

        @Test
        @DisplayName("True, False and None are literals")
        void capitalisedConstants() {
            assertThat(((ExprNode.Literal) bare("True")).value()).isEqualTo(true);
            assertThat(((ExprNode.Literal) bare("False")).value()).isEqualTo(false);
            assertThat(((ExprNode.Literal) bare("None")).kind()).isEqualTo(LiteralKind.NULL);
        }

        @Test
        @DisplayName("single- and double-quoted strings are both STR")
        void strings() {
            assertThat(((ExprNode.Literal) bare("'gaussian'")).value()).isEqualTo("gaussian");
            assertThat(((ExprNode.Literal) bare("\"gaussian\"")).value()).isEqualTo("gaussian");
            assertThat(((ExprNode.Literal) bare("'g'")).kind()).isEqualTo(LiteralKind.STR);
        }
    }

    @Nested
    @DisplayName("assignments")
    class Assignments {

        @Test
        @DisplayName("simple assignment")
        void simpleAssignment() {
            Statement statement = parser.parse("price_diff = close - open").statements().get(0);

            assertThat(statement).isInstanceOf(Statement.Assignment.class);
            assertThat(((Statement.Assignment) statement).targets()).containsExactly("price_diff");
        }

        @Test
        @DisplayName("assignment chains bind every target")
        void chainedAssignment() {
            Statement.Assignment statement =
                    (Statement.Assignment) parser.parse("a = b = close").statements().get(0);

            assertThat(statement.targets()).containsExactly("a", "b");
            assertThat(statement.value()).isInstanceOf(ExprNode.Name.class);
        }

        @Test
        @DisplayName("augmented assignment is desugared")
        void augmentedAssignment() {
            Statement.Assignment statement = (Statement.Assignment) parser.parse("a += 1").statements().get(0);

            assertThat(statement.targets()).containsExactly("a");
            assertThat(statement.value()).isInstanceOf(ExprNode.Binary.class);
            ExprNode.Binary value = (ExprNode.Binary) statement.value();
            assertThat(value.operator()).isEqualTo("+");
            assertThat(value.left()).isInstanceOf(ExprNode.Name.class);
        }

        @Test
        @DisplayName("shift assignment is rejected")
        void shiftAssignment() {
            assertThatThrownBy(() -> parser.parse("a <<= 1")).isInstanceOf(UnsupportedConstructException.class);
        }

        @Test
        @DisplayName("assignment used as a value is rejected")
        void assignmentAsValue() {
            assertThatThrownBy(() -> parser.parse("f(x) + (a = 1)"))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageContaining("assignment used as a value");
        }
    }

    @Nested
    @DisplayName("rejected input")
    class Rejected {

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"close[0]", "close.value", "x -> x", "new Object()", "(int) close", "this"})
        @DisplayName("constructs outside the grammar subset are unsupported")
        void unsupportedConstructs(String text) {
            assertThatThrownBy(() -> parser.parse(text))
                    .isInstanceOf(UnsupportedConstructException.class)
                    .hasMessageStartingWith("Unsupported construct at line 1");
        }

        @Test
        @DisplayName("syntax errors carry the position and fragment")
        void syntaxError() {
            assertThatThrownBy(() -> parser.parse("a = 1; b = ts_mean(close,"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageStartingWith("Syntax error at line 1")
                    .satisfies(e -> {
                        ExtractionException ex = (ExtractionException) e;
                        assertThat(ex.line()).isEqualTo(1);
                        assertThat(ex.column()).isGreaterThanOrEqualTo(7);
                        assertThat(ex.fragment()).isEqualTo("b = ts_mean(close,");
                    });
        }

        @ParameterizedTest(name = "{0} -> column {1}")
        @CsvSource(
                delimiter = '|',
                value = {
                    "close + open open|14",
                    "ts_mean(close, 5) + + * 2|23",
                    "a = 1; close + open open|21"
                })
        @DisplayName("syntax errors point at the offending token")
        void syntaxErrorColumn(String text, int column) {
            assertThatThrownBy(() -> parser.parse(text))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .hasMessageStartingWith("Syntax error at line 1, column " + column + ":")
                    .satisfies(e -> {
                        ExtractionException ex = (ExtractionException) e;
                        assertThat(ex.line()).isEqualTo(1);
                        assertThat(ex.column()).isEqualTo(column);
                    });
        }

        @Test
        @DisplayName("syntax errors on a later line keep that line")
        void syntaxErrorLaterLine() {
            assertThatThrownBy(() -> parser.parse("a = close;\nb = a a"))
                    .isInstanceOf(ExpressionSyntaxException.class)
                    .satisfies(e -> {
                        ExtractionException ex = (ExtractionException) e;
                        assertThat(ex.line()).isEqualTo(2);
                        assertThat(ex.column()).isEqualTo(7);
                    });
        }

        @Test
        @DisplayName("a reserved word cannot be a keyword name")
        void reservedWordKeyword() {
            assertThatThrownBy(() -> parser.parse("f(x, class=1)")).isInstanceOf(ExpressionSyntaxException.class);
        }

        @Test
        @DisplayName("the Python power operator is a syntax error")
        void powerOperator() {
            assertThatThrownBy(() -> parser.parse("close ** 2")).isInstanceOf(ExpressionSyntaxException.class);
        }
    }

    @Nested
    @DisplayName("positions")
    class Positions {

        @Test
        @DisplayName("positions are relative to the whole text")
        void positionsAcrossStatements() {
            ParsedExpression parsed = parser.parse("a = close;\n  b = ts_mean(open, 5)");
            Statement.Assignment second = (Statement.Assignment) parsed.statements().get(1);

            assertThat(second.value().position()).isEqualTo(new Position(2, 7));
            ExprNode.Call call = (ExprNode.Call) second.value();
            assertThat(call.args().get(0).position()).isEqualTo(new Position(2, 15));
        }

        @Test
        @DisplayName("columns on the first line are offset by the statement start")
        void sameLineOffset() {
            ParsedExpression parsed = parser.parse("a = 1; b + c");
            ExprNode.Binary binary = (ExprNode.Binary) ((Statement.Bare) parsed.statements().get(1)).expression();

            assertThat(binary.right().position()).isEqualTo(new Position(1, 12));
        }
    }
}
