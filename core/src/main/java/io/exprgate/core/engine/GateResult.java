package io.exprgate.core.engine;

import io.exprgate.core.model.Extraction;
import io.exprgate.core.model.ValidationReport;
import java.util.Objects;

/**
 * Outcome of {@link ExpressionGate#check(String)}: what the expression uses and what is wrong with it.
 *
 * @param extraction operators, datafields and call sites of the expression
 * @param report     violations found against the active schema
 */
public record GateResult(Extraction extraction, ValidationReport report) {

    public GateResult {
        Objects.requireNonNull(extraction, "extraction must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }

    public boolean isValid() {
        return report.isValid();
    }
}
