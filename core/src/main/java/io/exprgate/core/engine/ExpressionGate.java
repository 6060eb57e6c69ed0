package io.exprgate.core.engine;

import io.exprgate.core.model.Extraction;
import io.exprgate.core.model.RuleSchema;
import io.exprgate.core.model.ValidationReport;
import io.exprgate.core.parser.JavaParserTreeParser;
import io.exprgate.core.rules.RuleSchemaParser;
import io.exprgate.core.spi.ExpressionTreeParser;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: extracts an expression and validates it against the active {@link RuleSchema}.
 *
 * <p>Thread-safe: the schema is held in an {@link AtomicReference}. {@link #reload} swaps it atomically, so a
 * check already running completes against the schema it started with while later checks see the new one.
 */
public final class ExpressionGate {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionGate.class);

    private final ExpressionExtractor extractor;
    private final ExpressionValidator validator;
    private final AtomicReference<RuleSchema> schemaRef;

    public ExpressionGate(ExpressionTreeParser parser, ValidatorOptions options, RuleSchema schema) {
        this.extractor = new ExpressionExtractor(parser);
        this.validator = new ExpressionValidator(options);
        this.schemaRef = new AtomicReference<>(Objects.requireNonNull(schema, "schema must not be null"));
        LOG.info(
                "Expression gate ready: parser={}, operators={}, datafields={}, vectorPrefix={}",
                parser.id(),
                schema.operatorCount(),
                schema.datafieldCount(),
                options.vectorPrefix());
    }

    /** Creates a gate backed by JavaParser with default validator options. */
    public static ExpressionGate withDefaults(RuleSchema schema) {
        return new ExpressionGate(new JavaParserTreeParser(), ValidatorOptions.defaults(), schema);
    }

    /**
     * Extracts and validates the expression.
     *
     * @param text expression source
     * @return extraction plus report; a populated report is a normal result
     * @throws io.exprgate.core.error.ExtractionException if the expression could not be analyzed
     */
    public GateResult check(String text) {
        RuleSchema schema = schemaRef.get();
        Extraction extraction = extractor.extract(text);
        ValidationReport report = validator.validate(extraction, schema);
        LOG.debug(
                "Checked expression: operators={}, datafields={}, calls={}, violations={}",
                extraction.operators().size(),
                extraction.datafields().size(),
                extraction.callSites().size(),
                report.size());
        return new GateResult(extraction, report);
    }

    /** Extracts the expression without validating it. */
    public Extraction extract(String text) {
        return extractor.extract(text);
    }

    /** Validates a previously extracted expression against the active schema. */
    public ValidationReport validate(Extraction extraction) {
        return validator.validate(extraction, schemaRef.get());
    }

    /** Returns the active schema snapshot. */
    public RuleSchema schema() {
        return schemaRef.get();
    }

    /** Atomically replaces the active schema. */
    public void reload(RuleSchema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        RuleSchema previous = schemaRef.getAndSet(schema);
        LOG.info(
                "Rule schema reloaded: operators={} (was {}), datafields={} (was {})",
                schema.operatorCount(),
                previous.operatorCount(),
                schema.datafieldCount(),
                previous.datafieldCount());
    }

    /**
     * Loads both rule tables and swaps them in. On failure the active schema is left untouched.
     *
     * @throws io.exprgate.core.error.RuleSchemaException if either table is malformed
     */
    public void reload(Path operatorTable, Path datafieldTable, RuleSchemaParser parser) {
        Objects.requireNonNull(parser, "parser must not be null");
        reload(parser.parse(operatorTable, datafieldTable));
    }
}
