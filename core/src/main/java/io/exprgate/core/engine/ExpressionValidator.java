package io.exprgate.core.engine;

import io.exprgate.core.model.CallSite;
import io.exprgate.core.model.DatafieldDecl;
import io.exprgate.core.model.DatafieldKind;
import io.exprgate.core.model.DatafieldUse;
import io.exprgate.core.model.ExprNode;
import io.exprgate.core.model.Extraction;
import io.exprgate.core.model.KwargRule;
import io.exprgate.core.model.OperatorKind;
import io.exprgate.core.model.OperatorRule;
import io.exprgate.core.model.OperatorUse;
import io.exprgate.core.model.Position;
import io.exprgate.core.model.RuleSchema;
import io.exprgate.core.model.ValidationReport;
import io.exprgate.core.model.Violation;
import io.exprgate.core.model.ViolationCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks an {@link Extraction} against a {@link RuleSchema}.
 *
 * <p>Every check runs over every call site and use; nothing short-circuits. Violations are reported in {@link
 * ViolationCategory} order and, inside a category, in order of first appearance. The same inputs always give an
 * equal report.
 *
 * <p>An invalid expression is a normal result, never an exception. Only null arguments throw.
 *
 * <p>Stateless and thread-safe.
 */
public final class ExpressionValidator {

    private final ValidatorOptions options;

    public ExpressionValidator() {
        this(ValidatorOptions.defaults());
    }

    public ExpressionValidator(ValidatorOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public ValidatorOptions options() {
        return options;
    }

    /**
     * Validates the extraction.
     *
     * @param extraction output of {@link ExpressionExtractor}
     * @param schema     operator and datafield tables
     * @return the report, empty if the expression is valid
     * @throws NullPointerException if either argument is null
     */
    public ValidationReport validate(Extraction extraction, RuleSchema schema) {
        Objects.requireNonNull(extraction, "extraction must not be null");
        Objects.requireNonNull(schema, "schema must not be null");

        Findings findings = new Findings();
        checkOperatorMembership(extraction, schema, findings);
        checkDatafieldMembership(extraction, schema, findings);
        checkArity(extraction, schema, findings);
        for (CallSite call : extraction.callSites()) {
            checkKeywords(call, schema.lookupOperator(call.operator()), findings);
        }
        checkVectorScope(extraction, schema, findings);
        return findings.toReport();
    }

    private void checkOperatorMembership(Extraction extraction, RuleSchema schema, Findings findings) {
        for (String operator : extraction.operators()) {
            if (schema.hasOperator(operator)) {
                continue;
            }
            OperatorUse first = extraction.firstUseOf(operator);
            findings.add(
                    ViolationCategory.UNKNOWN_OPERATOR,
                    operator,
                    first != null ? first.callIndex() : null,
                    "Operator '" + operator + "' is not defined or allowed",
                    first != null ? first.position() : null);
        }
    }

    private void checkDatafieldMembership(Extraction extraction, RuleSchema schema, Findings findings) {
        for (String datafield : extraction.datafields()) {
            if (schema.hasDatafield(datafield)) {
                continue;
            }
            DatafieldUse first = extraction.firstUseOfDatafield(datafield);
            findings.add(
                    ViolationCategory.UNKNOWN_DATAFIELD,
                    datafield,
                    null,
                    "Datafield '" + datafield + "' is not defined or allowed",
                    first != null ? first.position() : null);
        }
    }

    private void checkArity(Extraction extraction, RuleSchema schema, Findings findings) {
        for (OperatorUse use : extraction.operatorUses()) {
            if (use.kind() != OperatorKind.CALL && use.kind() != OperatorKind.BOOLEAN) {
                continue;
            }
            Optional<OperatorRule> rule = schema.lookupOperator(use.token());
            if (rule.isEmpty() || rule.get().acceptsArity(use.arity())) {
                continue;
            }
            String unit = use.isCall() ? "positional argument(s)" : "operand(s)";
            findings.add(
                    ViolationCategory.ARITY,
                    use.token(),
                    use.callIndex(),
                    "'" + use.token() + "' expects " + rule.get().describeArity() + " " + unit + ", got "
                            + use.arity(),
                    use.position());
        }
    }

    private void checkKeywords(CallSite call, Optional<OperatorRule> rule, Findings findings) {
        String operator = call.operator();
        for (String duplicate : call.duplicateKeywords()) {
            findings.add(
                    ViolationCategory.DUPLICATE_KWARG,
                    operator,
                    call.index(),
                    "Keyword argument '" + duplicate + "' is repeated in '" + operator + "'",
                    call.position());
        }
        if (rule.isEmpty()) {
            return;
        }
        for (Map.Entry<String, ExprNode> keyword : call.keywords().entrySet()) {
            String name = keyword.getKey();
            Optional<KwargRule> kwargRule = rule.get().kwarg(name);
            if (kwargRule.isEmpty()) {
                findings.add(
                        ViolationCategory.UNKNOWN_KWARG,
                        operator,
                        call.index(),
                        "Invalid keyword argument '" + name + "' for '" + operator + "'",
                        keyword.getValue().position());
                continue;
            }
            checkKeywordValue(call, name, keyword.getValue(), kwargRule.get(), findings);
        }
    }

    private void checkKeywordValue(CallSite call, String name, ExprNode value, KwargRule rule, Findings findings) {
        String operator = call.operator();
        if (!(value instanceof ExprNode.Literal literal)) {
            findings.add(
                    ViolationCategory.KWARG_TYPE,
                    operator,
                    call.index(),
                    "Keyword argument '" + name + "' in '" + operator + "' must be a " + rule.type().id()
                            + " literal, got an expression that cannot be checked statically",
                    value.position());
            return;
        }
        if (!rule.type().accepts(literal.kind())) {
            findings.add(
                    ViolationCategory.KWARG_TYPE,
                    operator,
                    call.index(),
                    "Invalid type for keyword argument '" + name + "' in '" + operator + "': expected "
                            + rule.type().id() + ", got " + literal.kind().label() + " " + literal.render(),
                    literal.position());
            return;
        }
        if (rule.hasBounds() && literal.isNumeric()
                && !rule.inRange(((Number) literal.value()).doubleValue())) {
            findings.add(
                    ViolationCategory.KWARG_RANGE,
                    operator,
                    call.index(),
                    "Value " + literal.render() + " for '" + name + "' in '" + operator + "' is outside "
                            + rule.describeBounds(),
                    literal.position());
        }
        if (rule.hasAllowed() && !rule.permits(literal.value())) {
            findings.add(
                    ViolationCategory.KWARG_ALLOWED,
                    operator,
                    call.index(),
                    "Invalid value " + literal.render() + " for '" + name + "' in '" + operator
                            + "', expected one of " + rule.allowed(),
                    literal.position());
        }
    }

    private void checkVectorScope(Extraction extraction, RuleSchema schema, Findings findings) {
        for (DatafieldUse use : extraction.datafieldUses()) {
            boolean vector = schema.lookupDatafield(use.name())
                    .map(DatafieldDecl::kind)
                    .filter(kind -> kind == DatafieldKind.VECTOR)
                    .isPresent();
            if (!vector) {
                continue;
            }
            if (use.isDirectArgument()
                    && options.isVectorAware(extraction.callSite(use.argumentOf()).operator())) {
                continue;
            }
            String where = use.isDirectArgument()
                    ? "is passed to '" + extraction.callSite(use.argumentOf()).operator() + "'"
                    : "is not a direct argument of any call";
            findings.add(
                    ViolationCategory.VECTOR_SCOPE,
                    use.name(),
                    use.argumentOf(),
                    "Datafield '" + use.name() + "' of type VECTOR " + where + "; it must be a direct argument of a '"
                            + options.vectorPrefix() + "' operator",
                    use.position());
        }
    }

    /** Violations grouped by category; flattened in category order. */
    private static final class Findings {

        private final Map<ViolationCategory, List<Violation>> byCategory = new EnumMap<>(ViolationCategory.class);

        void add(ViolationCategory category, String subject, Integer callIndex, String detail, Position position) {
            byCategory
                    .computeIfAbsent(category, c -> new ArrayList<>())
                    .add(new Violation(category, subject, callIndex, detail, position));
        }

        ValidationReport toReport() {
            List<Violation> ordered = new ArrayList<>();
            byCategory.values().forEach(ordered::addAll);
            return new ValidationReport(ordered);
        }
    }
}
