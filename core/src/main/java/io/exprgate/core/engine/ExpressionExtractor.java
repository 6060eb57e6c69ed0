package io.exprgate.core.engine;

import io.exprgate.core.model.CallSite;
import io.exprgate.core.model.DatafieldUse;
import io.exprgate.core.model.ExprNode;
import io.exprgate.core.model.Extraction;
import io.exprgate.core.model.OperatorKind;
import io.exprgate.core.model.OperatorUse;
import io.exprgate.core.model.ParsedExpression;
import io.exprgate.core.model.Statement;
import io.exprgate.core.spi.ExpressionTreeParser;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a parsed expression and collects its operators, free variables and call sites.
 *
 * <p>Statements are processed left to right. An assignment's value is walked before its targets are bound, so
 * {@code a = a + 1} reports {@code a} as a datafield when {@code a} was not assigned earlier. Once bound, a name is
 * a local for every later statement and is never reported as a datafield.
 *
 * <p>Stateless and thread-safe; all per-expression state lives in a {@link Walk} created per call.
 */
public final class ExpressionExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionExtractor.class);

    private final ExpressionTreeParser parser;

    public ExpressionExtractor(ExpressionTreeParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Parses and walks the expression text.
     *
     * @param text expression source, statements separated by {@code ;}
     * @return the extraction; empty for blank text
     * @throws io.exprgate.core.error.ExpressionSyntaxException     if the parser rejects the text
     * @throws io.exprgate.core.error.UnsupportedConstructException if the text uses an unsupported construct
     */
    public Extraction extract(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return extract(parser.parse(text));
    }

    /** Walks an already parsed expression. */
    public Extraction extract(ParsedExpression parsed) {
        Objects.requireNonNull(parsed, "parsed must not be null");
        Walk walk = new Walk();
        for (Statement statement : parsed.statements()) {
            walk.statement(statement);
        }
        Extraction extraction = walk.result();
        LOG.debug(
                "Extracted expression: statements={}, operators={}, datafields={}, calls={}",
                parsed.statements().size(),
                extraction.operators(),
                extraction.datafields(),
                extraction.callSites().size());
        return extraction;
    }

    /**
     * Mutable state of one extraction. {@code argumentOf} is the index of the call whose direct argument is being
     * walked, or {@code null} below any operator or at top level.
     */
    private static final class Walk {

        private final Set<String> bound = new LinkedHashSet<>();
        private final Set<String> operators = new LinkedHashSet<>();
        private final Set<String> datafields = new LinkedHashSet<>();
        private final List<CallSite> callSites = new ArrayList<>();
        private final List<OperatorUse> operatorUses = new ArrayList<>();
        private final List<DatafieldUse> datafieldUses = new ArrayList<>();

        void statement(Statement statement) {
            if (statement instanceof Statement.Assignment assignment) {
                walk(assignment.value(), null);
                bound.addAll(assignment.targets());
            } else if (statement instanceof Statement.Bare bare) {
                walk(bare.expression(), null);
            }
        }

        private void walk(ExprNode node, Integer argumentOf) {
            node.accept(new ExprNode.Visitor<Void>() {
                @Override
                public Void visitName(ExprNode.Name name) {
                    if (!bound.contains(name.id())) {
                        datafields.add(name.id());
                        datafieldUses.add(new DatafieldUse(name.id(), name.position(), argumentOf));
                    }
                    return null;
                }

                @Override
                public Void visitLiteral(ExprNode.Literal literal) {
                    return null;
                }

                @Override
                public Void visitCall(ExprNode.Call call) {
                    // reserve the slot first so outer calls precede the calls nested in their arguments
                    int index = callSites.size();
                    callSites.add(null);
                    recordUse(call.function(), OperatorKind.CALL, call.args().size(), index, call);
                    for (ExprNode arg : call.args()) {
                        walk(arg, index);
                    }
                    for (ExprNode.Keyword keyword : call.keywords()) {
                        walk(keyword.value(), index);
                    }
                    callSites.set(index, CallSite.of(index, call));
                    return null;
                }

                @Override
                public Void visitBinary(ExprNode.Binary binary) {
                    recordUse(binary.operator(), OperatorKind.ARITHMETIC, 2, null, binary);
                    walk(binary.left(), null);
                    walk(binary.right(), null);
                    return null;
                }

                @Override
                public Void visitCompare(ExprNode.Compare compare) {
                    recordUse(compare.operator(), OperatorKind.COMPARISON, 2, null, compare);
                    walk(compare.left(), null);
                    walk(compare.right(), null);
                    return null;
                }

                @Override
                public Void visitBoolOp(ExprNode.BoolOp boolOp) {
                    recordUse(boolOp.operator(), OperatorKind.BOOLEAN, boolOp.operands().size(), null, boolOp);
                    for (ExprNode operand : boolOp.operands()) {
                        walk(operand, null);
                    }
                    return null;
                }

                @Override
                public Void visitUnary(ExprNode.Unary unary) {
                    recordUse(unary.operator(), OperatorKind.UNARY, 1, null, unary);
                    walk(unary.operand(), null);
                    return null;
                }
            });
        }

        private void recordUse(String token, OperatorKind kind, int arity, Integer callIndex, ExprNode node) {
            operators.add(token);
            operatorUses.add(new OperatorUse(token, kind, arity, callIndex, node.position()));
        }

        Extraction result() {
            return new Extraction(
                    new ArrayList<>(operators),
                    new ArrayList<>(datafields),
                    callSites,
                    operatorUses,
                    datafieldUses,
                    new ArrayList<>(bound));
        }
    }
}
