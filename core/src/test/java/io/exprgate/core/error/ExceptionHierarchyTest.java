package io.exprgate.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one load-time type, two extraction-time types under a common parent. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void exprGateExceptionIsAbstractAndRoot() {
        assertThat(ExprGateException.class).isAbstract();
        assertThat(ExprGateException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void extractionExceptionIsAbstract() {
        assertThat(ExtractionException.class).isAbstract();
        assertThat(ExtractionException.class.getSuperclass()).isEqualTo(ExprGateException.class);
    }

    // --- Load time ---

    @Test
    void ruleSchemaExceptionIsLoadPhase() {
        var ex = new RuleSchemaException("bad table", "/rules/operators.json");

        assertThat(ex).isInstanceOf(ExprGateException.class);
        assertThat(ex.detail()).isEqualTo("bad table");
        assertThat(ex.phase()).isEqualTo(ExprGateException.Phase.LOAD);
        assertThat(ex.source()).isEqualTo("/rules/operators.json");
    }

    @Test
    void ruleSchemaExceptionWithoutSource() {
        var ex = new RuleSchemaException("duplicate ids");

        assertThat(ex.source()).isNull();
    }

    @Test
    void ruleSchemaExceptionKeepsCause() {
        var cause = new java.io.IOException("disk");
        var ex = new RuleSchemaException("unreadable", cause, "/rules/operators.json");

        assertThat(ex.getCause()).isSameAs(cause);
    }

    // --- Extraction time ---

    @Test
    void expressionSyntaxExceptionCarriesLocation() {
        var cause = new IllegalStateException("parser");
        var ex = new ExpressionSyntaxException("Syntax error", cause, "ts_mean(close,", 1, 15);

        assertThat(ex).isInstanceOf(ExtractionException.class);
        assertThat(ex.phase()).isEqualTo(ExprGateException.Phase.EXTRACTION);
        assertThat(ex.fragment()).isEqualTo("ts_mean(close,");
        assertThat(ex.line()).isEqualTo(1);
        assertThat(ex.column()).isEqualTo(15);
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void unsupportedConstructExceptionIsExtractionPhase() {
        var ex = new UnsupportedConstructException("Unsupported construct", "close[0]", 2, 3);

        assertThat(ex).isInstanceOf(ExtractionException.class);
        assertThat(ex.phase()).isEqualTo(ExprGateException.Phase.EXTRACTION);
        assertThat(ex.line()).isEqualTo(2);
    }

    // --- Catch-all ---

    @Test
    void allExceptionsCatchableAsExprGateException() {
        ExprGateException[] exceptions = {
            new RuleSchemaException("a"),
            new ExpressionSyntaxException("b", "x", 1, 1),
            new UnsupportedConstructException("c", "y", 1, 1)
        };

        for (ExprGateException ex : exceptions) {
            assertThat(ex).isInstanceOf(RuntimeException.class);
            assertThat(ex.phase()).isNotNull();
        }
    }
}
