package io.exprgate.core.model;

/** Syntactic family of an operator token. */
public enum OperatorKind {
    /** Function-call name. */
    CALL,
    /** {@code + - * / %}. */
    ARITHMETIC,
    /** {@code > < >= <= == !=}. */
    COMPARISON,
    /** {@code && ||}. */
    BOOLEAN,
    /** Prefix {@code - + !}. */
    UNARY
}
