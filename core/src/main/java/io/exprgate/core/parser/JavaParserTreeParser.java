package io.exprgate.core.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.Token;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import io.exprgate.core.error.ExpressionSyntaxException;
import io.exprgate.core.error.UnsupportedConstructException;
import io.exprgate.core.model.ExprNode;
import io.exprgate.core.model.LiteralKind;
import io.exprgate.core.model.ParsedExpression;
import io.exprgate.core.model.Position;
import io.exprgate.core.model.Statement;
import io.exprgate.core.spi.ExpressionTreeParser;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link ExpressionTreeParser} backed by JavaParser. Each {@code ;}-separated statement is parsed as a Java
 * expression and the resulting tree is mapped onto the closed {@link ExprNode} variant set. Any JavaParser node
 * without a counterpart is rejected with {@link UnsupportedConstructException}.
 *
 * <p>Mapping rules:
 * <ul>
 * <li>{@code name = value} inside call arguments is a keyword argument; at statement level it is an
 * assignment (chains {@code a = b = x} allowed);</li>
 * <li>{@code a op= x} is desugared to {@code a = a op x};</li>
 * <li>{@code True}/{@code False}/{@code None} are accepted as spellings of {@code true}/{@code false}/{@code
 * null};</li>
 * <li>a sign applied to a numeric literal is folded into the literal;</li>
 * <li>chains of the same {@code &&}/{@code ||} operator are flattened into one n-ary node.</li>
 * </ul>
 *
 * <p>Thread-safe: a new {@link JavaParser} is created per statement since JavaParser instances are not.
 */
public final class JavaParserTreeParser implements ExpressionTreeParser {

    /** Parser identifier. */
    public static final String PARSER_ID = "javaparser";

    private final ParserConfiguration configuration;

    public JavaParserTreeParser() {
        this.configuration =
                new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    @Override
    public String id() {
        return PARSER_ID;
    }

    @Override
    public ParsedExpression parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        List<Statement> statements = new ArrayList<>();
        for (StatementSplitter.Segment segment : StatementSplitter.split(text)) {
            Expression expression = parseSegment(segment);
            statements.add(new SegmentMapper(segment).toStatement(expression));
        }
        return new ParsedExpression(text, statements);
    }

    private Expression parseSegment(StatementSplitter.Segment segment) {
        ParseResult<Expression> result = new JavaParser(configuration).parseExpression(segment.text());
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        Problem problem = result.getProblems().isEmpty() ? null : result.getProblems().get(0);
        Position position = toPosition(segment, problem == null ? null : offendingPosition(problem));
        String reason = problem != null ? problem.getMessage() : "unparseable statement";
        String message = "Syntax error at " + position + ": " + reason;
        Throwable cause = problem != null ? problem.getCause().orElse(null) : null;
        String fragment = segment.text().strip();
        if (cause != null) {
            throw new ExpressionSyntaxException(message, cause, fragment, position.line(), position.column());
        }
        throw new ExpressionSyntaxException(message, fragment, position.line(), position.column());
    }

    /**
     * Local position of the token the parser choked on. The problem's token range starts at the beginning of the
     * statement, so the token following the last one consumed is preferred; the range end is the fallback.
     */
    private static com.github.javaparser.Position offendingPosition(Problem problem) {
        if (problem.getCause().orElse(null) instanceof ParseException parseException
                && parseException.currentToken != null
                && parseException.currentToken.next != null) {
            Token offending = parseException.currentToken.next;
            return new com.github.javaparser.Position(offending.beginLine, offending.beginColumn);
        }
        return problem.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.end)
                .orElse(null);
    }

    /** Translates a position inside a segment into a position inside the whole expression text. */
    static Position toPosition(StatementSplitter.Segment segment, com.github.javaparser.Position local) {
        if (local == null) {
            return new Position(segment.line(), segment.column());
        }
        if (local.line == 1) {
            return new Position(segment.line(), segment.column() + local.column - 1);
        }
        return new Position(segment.line() + local.line - 1, local.column);
    }

    /** Maps the JavaParser tree of one segment onto {@link ExprNode}s. */
    private static final class SegmentMapper {

        private final StatementSplitter.Segment segment;

        SegmentMapper(StatementSplitter.Segment segment) {
            this.segment = segment;
        }

        Statement toStatement(Expression expression) {
            if (!(expression instanceof AssignExpr assign)) {
                return new Statement.Bare(map(expression));
            }
            if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
                return desugarAugmented(assign);
            }
            List<String> targets = new ArrayList<>();
            Expression value = assign;
            while (value instanceof AssignExpr chained) {
                if (chained.getOperator() != AssignExpr.Operator.ASSIGN) {
                    throw unsupported(chained, "augmented assignment inside an assignment chain");
                }
                targets.add(targetName(chained));
                value = chained.getValue();
            }
            return new Statement.Assignment(targets, map(value), position(assign));
        }

        private Statement desugarAugmented(AssignExpr assign) {
            String symbol = assign.getOperator()
                    .toBinaryOperator()
                    .map(this::arithmeticSymbol)
                    .orElse(null);
            if (symbol == null) {
                throw unsupported(assign, "assignment operator '" + assign.getOperator().asString() + "'");
            }
            if (assign.getValue() instanceof AssignExpr nested) {
                throw unsupported(nested, "assignment used as a value");
            }
            String target = targetName(assign);
            Position at = position(assign);
            ExprNode value = new ExprNode.Binary(
                    symbol, new ExprNode.Name(target, position(assign.getTarget())), map(assign.getValue()), at);
            return new Statement.Assignment(List.of(target), value, at);
        }

        private String targetName(AssignExpr assign) {
            if (assign.getTarget() instanceof NameExpr name) {
                return name.getNameAsString();
            }
            throw unsupported(assign.getTarget(), "assignment target other than a simple name");
        }

        ExprNode map(Expression expression) {
            if (expression instanceof EnclosedExpr enclosed) {
                return map(enclosed.getInner());
            }
            if (expression instanceof NameExpr name) {
                return mapName(name);
            }
            if (expression instanceof MethodCallExpr call) {
                return mapCall(call);
            }
            if (expression instanceof BinaryExpr binary) {
                return mapBinary(binary);
            }
            if (expression instanceof UnaryExpr unary) {
                return mapUnary(unary);
            }
            if (expression instanceof IntegerLiteralExpr || expression instanceof LongLiteralExpr) {
                return ExprNode.Literal.ofInt(parseInteger(expression), position(expression));
            }
            if (expression instanceof DoubleLiteralExpr decimal) {
                return ExprNode.Literal.ofFloat(decimal.asDouble(), position(expression));
            }
            if (expression instanceof BooleanLiteralExpr bool) {
                return ExprNode.Literal.ofBool(bool.getValue(), position(expression));
            }
            if (expression instanceof StringLiteralExpr string) {
                return ExprNode.Literal.ofStr(string.asString(), position(expression));
            }
            if (expression instanceof CharLiteralExpr character) {
                return ExprNode.Literal.ofStr(String.valueOf(character.asChar()), position(expression));
            }
            if (expression instanceof NullLiteralExpr) {
                return ExprNode.Literal.ofNull(position(expression));
            }
            if (expression instanceof AssignExpr) {
                throw unsupported(expression, "assignment used as a value");
            }
            throw unsupported(expression, describe(expression));
        }

        private ExprNode mapName(NameExpr name) {
            Position at = position(name);
            return switch (name.getNameAsString()) {
                case "True" -> ExprNode.Literal.ofBool(true, at);
                case "False" -> ExprNode.Literal.ofBool(false, at);
                case "None" -> ExprNode.Literal.ofNull(at);
                default -> new ExprNode.Name(name.getNameAsString(), at);
            };
        }

        private ExprNode mapCall(MethodCallExpr call) {
            if (call.getScope().isPresent()) {
                throw unsupported(
                        call, "method call on a target ('" + call.getScope().get() + "." + call.getNameAsString() + "')");
            }
            if (call.getTypeArguments().isPresent()) {
                throw unsupported(call, "explicit type arguments");
            }
            List<ExprNode> args = new ArrayList<>();
            List<ExprNode.Keyword> keywords = new ArrayList<>();
            for (Expression argument : call.getArguments()) {
                if (argument instanceof AssignExpr keyword) {
                    keywords.add(mapKeyword(keyword));
                } else if (!keywords.isEmpty()) {
                    throw unsupported(argument, "positional argument after a keyword argument");
                } else {
                    args.add(map(argument));
                }
            }
            return new ExprNode.Call(call.getNameAsString(), args, keywords, position(call));
        }

        private ExprNode.Keyword mapKeyword(AssignExpr keyword) {
            if (keyword.getOperator() != AssignExpr.Operator.ASSIGN) {
                throw unsupported(keyword, "assignment operator '" + keyword.getOperator().asString()
                        + "' in an argument list");
            }
            if (!(keyword.getTarget() instanceof NameExpr name)) {
                throw unsupported(keyword.getTarget(), "keyword argument name other than a simple name");
            }
            if (keyword.getValue() instanceof AssignExpr nested) {
                throw unsupported(nested, "assignment used as a value");
            }
            return new ExprNode.Keyword(name.getNameAsString(), map(keyword.getValue()), position(keyword));
        }

        private ExprNode mapBinary(BinaryExpr binary) {
            BinaryExpr.Operator operator = binary.getOperator();
            Position at = position(binary);
            String arithmetic = arithmeticSymbol(operator);
            if (arithmetic != null) {
                return new ExprNode.Binary(arithmetic, map(binary.getLeft()), map(binary.getRight()), at);
            }
            switch (operator) {
                case EQUALS:
                case NOT_EQUALS:
                case LESS:
                case GREATER:
                case LESS_EQUALS:
                case GREATER_EQUALS:
                    return new ExprNode.Compare(
                            operator.asString(), map(binary.getLeft()), map(binary.getRight()), at);
                case AND:
                case OR:
                    List<ExprNode> operands = new ArrayList<>();
                    flatten(binary, operator, operands);
                    return new ExprNode.BoolOp(operator.asString(), operands, at);
                default:
                    throw unsupported(binary, "operator '" + operator.asString() + "'");
            }
        }

        private void flatten(Expression expression, BinaryExpr.Operator operator, List<ExprNode> operands) {
            if (expression instanceof BinaryExpr binary && binary.getOperator() == operator) {
                flatten(binary.getLeft(), operator, operands);
                flatten(binary.getRight(), operator, operands);
            } else {
                operands.add(map(expression));
            }
        }

        private ExprNode mapUnary(UnaryExpr unary) {
            Position at = position(unary);
            switch (unary.getOperator()) {
                case MINUS:
                case PLUS:
                    ExprNode operand = map(unary.getExpression());
                    if (operand instanceof ExprNode.Literal literal && literal.isNumeric()) {
                        return unary.getOperator() == UnaryExpr.Operator.PLUS
                                ? new ExprNode.Literal(literal.kind(), literal.value(), at)
                                : negate(literal, at);
                    }
                    return new ExprNode.Unary(unary.getOperator().asString(), operand, at);
                case LOGICAL_COMPLEMENT:
                    return new ExprNode.Unary("!", map(unary.getExpression()), at);
                default:
                    throw unsupported(unary, "operator '" + unary.getOperator().asString() + "'");
            }
        }

        private ExprNode.Literal negate(ExprNode.Literal literal, Position at) {
            if (literal.kind() == LiteralKind.INT) {
                return ExprNode.Literal.ofInt(-((Long) literal.value()), at);
            }
            return ExprNode.Literal.ofFloat(-((Double) literal.value()), at);
        }

        private String arithmeticSymbol(BinaryExpr.Operator operator) {
            return switch (operator) {
                case PLUS, MINUS, MULTIPLY, DIVIDE, REMAINDER -> operator.asString();
                default -> null;
            };
        }

        private long parseInteger(Expression literal) {
            String raw = literal instanceof LongLiteralExpr longLiteral
                    ? longLiteral.getValue()
                    : ((IntegerLiteralExpr) literal).getValue();
            String digits = raw.replace("_", "").toLowerCase(Locale.ROOT);
            if (digits.endsWith("l")) {
                digits = digits.substring(0, digits.length() - 1);
            }
            int radix = 10;
            if (digits.startsWith("0x")) {
                radix = 16;
                digits = digits.substring(2);
            } else if (digits.startsWith("0b")) {
                radix = 2;
                digits = digits.substring(2);
            } else if (digits.length() > 1 && digits.startsWith("0")) {
                radix = 8;
                digits = digits.substring(1);
            }
            try {
                return new BigInteger(digits, radix).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                Position at = position(literal);
                throw new ExpressionSyntaxException(
                        "Integer literal out of range at " + at + ": " + raw, e, raw, at.line(), at.column());
            }
        }

        private Position position(Node node) {
            return toPosition(segment, node.getBegin().orElse(null));
        }

        private UnsupportedConstructException unsupported(Node node, String what) {
            Position at = position(node);
            String fragment = node.toString();
            return new UnsupportedConstructException(
                    "Unsupported construct at " + at + ": " + what + " in '" + fragment + "'",
                    fragment,
                    at.line(),
                    at.column());
        }

        private static String describe(Expression expression) {
            String simpleName = expression.getClass().getSimpleName();
            String base = simpleName.endsWith("Expr") ? simpleName.substring(0, simpleName.length() - 4) : simpleName;
            return base.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase(Locale.ROOT) + " expression";
        }
    }
}
