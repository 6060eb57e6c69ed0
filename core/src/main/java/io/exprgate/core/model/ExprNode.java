package io.exprgate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A node of the supported expression grammar. The hierarchy is sealed: every construct the extractor accepts
 * is one of the variants below, and anything else is rejected by the tree parser before a node is ever built.
 *
 * <p>Consumers dispatch through {@link Visitor}, so adding a variant is a compile-time-checked change for
 * every walker.
 *
 * <p>Immutable and thread-safe.
 */
public sealed interface ExprNode
        permits ExprNode.Name,
                ExprNode.Literal,
                ExprNode.Call,
                ExprNode.Binary,
                ExprNode.Compare,
                ExprNode.BoolOp,
                ExprNode.Unary {

    /** Position of the first character of this node. */
    Position position();

    <R> R accept(Visitor<R> visitor);

    /** Exhaustive visitor over all node variants. */
    interface Visitor<R> {
        R visitName(Name name);

        R visitLiteral(Literal literal);

        R visitCall(Call call);

        R visitBinary(Binary binary);

        R visitCompare(Compare compare);

        R visitBoolOp(BoolOp boolOp);

        R visitUnary(Unary unary);
    }

    // ── Variants ──

    /** A bare identifier in value position. */
    record Name(String id, Position position) implements ExprNode {
        public Name {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    /**
     * A constant. {@code value} is a {@link Boolean}, {@link Long}, {@link Double}, {@link String} or {@code null}
     * according to {@code kind}.
     */
    record Literal(LiteralKind kind, Object value, Position position) implements ExprNode {
        public Literal {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        public static Literal ofBool(boolean value, Position position) {
            return new Literal(LiteralKind.BOOL, value, position);
        }

        public static Literal ofInt(long value, Position position) {
            return new Literal(LiteralKind.INT, value, position);
        }

        public static Literal ofFloat(double value, Position position) {
            return new Literal(LiteralKind.FLOAT, value, position);
        }

        public static Literal ofStr(String value, Position position) {
            return new Literal(LiteralKind.STR, Objects.requireNonNull(value, "value must not be null"), position);
        }

        public static Literal ofNull(Position position) {
            return new Literal(LiteralKind.NULL, null, position);
        }

        public boolean isNumeric() {
            return kind == LiteralKind.INT || kind == LiteralKind.FLOAT;
        }

        /** Renders the value the way an author would have written it. */
        public String render() {
            return switch (kind) {
                case STR -> "'" + value + "'";
                case NULL -> "null";
                default -> String.valueOf(value);
            };
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * One keyword argument of a call, {@code name=value}.
     *
     * @param name     keyword name
     * @param value    argument expression
     * @param position position of the keyword name
     */
    record Keyword(String name, ExprNode value, Position position) {
        public Keyword {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }
    }

    /**
     * A function call {@code function(arg, ..., kw=value, ...)}. Keywords keep source order, repeats included.
     */
    record Call(String function, List<ExprNode> args, List<Keyword> keywords, Position position)
            implements ExprNode {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(position, "position must not be null");
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /** Arithmetic {@code left op right}, op one of {@code + - * / %}. */
    record Binary(String operator, ExprNode left, ExprNode right, Position position) implements ExprNode {
        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /** Comparison {@code left op right}, op one of {@code > < >= <= == !=}. */
    record Compare(String operator, ExprNode left, ExprNode right, Position position) implements ExprNode {
        public Compare {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    /**
     * Boolean {@code &&} / {@code ||}. A chain of the same operator is flattened into one node, so {@code a && b
     * && c} has three operands.
     */
    record BoolOp(String operator, List<ExprNode> operands, Position position) implements ExprNode {
        public BoolOp {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(position, "position must not be null");
            operands = List.copyOf(operands);
            if (operands.size() < 2) {
                throw new IllegalArgumentException("BoolOp requires at least two operands, got: " + operands.size());
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    /** Prefix {@code -x}, {@code +x} or {@code !x} applied to a non-literal operand. */
    record Unary(String operator, ExprNode operand, Position position) implements ExprNode {
        public Unary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
            Objects.requireNonNull(position, "position must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }
}
