package io.exprgate.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.exprgate.core.error.RuleSchemaException;
import io.exprgate.core.model.DatafieldDecl;
import io.exprgate.core.model.DatafieldKind;
import io.exprgate.core.model.KwargRule;
import io.exprgate.core.model.KwargType;
import io.exprgate.core.model.OperatorRule;
import io.exprgate.core.model.RuleSchema;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the operator table and the datafield table into an immutable {@link RuleSchema}.
 *
 * <p>Tables are JSON, or YAML when the file name ends in {@code .yaml}/{@code .yml}. Loading runs in two stages:
 * <ol>
 * <li>structural validation of each table against its bundled JSON Schema (2020-12). Unknown keys, wrong value
 * types and missing required fields are all reported at once;</li>
 * <li>semantic validation while building the rule records: arity bounds, type names, value bounds, allowed
 * values and duplicate ids.</li>
 * </ol>
 * Any failure is a {@link RuleSchemaException} naming the source; a schema is never half-built.
 *
 * <p>Thread-safe.
 */
public final class RuleSchemaParser {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSchemaParser.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /** Word spellings of the boolean operators accepted as operator-table keys. */
    static final Map<String, String> OPERATOR_ALIASES = Map.of("and", "&&", "or", "||", "not", "!");

    static final String OPERATOR_TABLE_SCHEMA = "/schemas/operator-table.schema.json";
    static final String DATAFIELD_TABLE_SCHEMA = "/schemas/datafield-table.schema.json";

    private final JsonSchema operatorTableSchema;
    private final JsonSchema datafieldTableSchema;

    public RuleSchemaParser() {
        this.operatorTableSchema = loadSchema(OPERATOR_TABLE_SCHEMA);
        this.datafieldTableSchema = loadSchema(DATAFIELD_TABLE_SCHEMA);
    }

    /**
     * Reads both tables from disk.
     *
     * @param operatorTable  path to the operator table
     * @param datafieldTable path to the datafield table
     * @return the loaded schema
     * @throws RuleSchemaException if a file is unreadable or a table is malformed
     */
    public RuleSchema parse(Path operatorTable, Path datafieldTable) {
        Objects.requireNonNull(operatorTable, "operatorTable must not be null");
        Objects.requireNonNull(datafieldTable, "datafieldTable must not be null");
        JsonNode operators = readTree(operatorTable);
        JsonNode datafields = readTree(datafieldTable);

        Map<String, OperatorRule> operatorRules = parseOperators(operators, operatorTable.toString());
        List<DatafieldDecl> decls = parseDatafields(datafields, datafieldTable.toString());
        RuleSchema schema = build(operatorRules, decls, operatorTable + ", " + datafieldTable);
        LOG.info(
                "Loaded rule schema: operators={} from {}, datafields={} from {}",
                schema.operatorCount(),
                operatorTable,
                schema.datafieldCount(),
                datafieldTable);
        return schema;
    }

    /**
     * Builds a schema from already parsed tables.
     *
     * @param operatorTable  JSON object of operator name to rule
     * @param datafieldTable JSON array of datafield declarations
     * @param source         label used in error messages, e.g. a resource name
     * @throws RuleSchemaException if a table is malformed
     */
    public RuleSchema parse(JsonNode operatorTable, JsonNode datafieldTable, String source) {
        Objects.requireNonNull(operatorTable, "operatorTable must not be null");
        Objects.requireNonNull(datafieldTable, "datafieldTable must not be null");
        Map<String, OperatorRule> operatorRules = parseOperators(operatorTable, source);
        List<DatafieldDecl> decls = parseDatafields(datafieldTable, source);
        RuleSchema schema = build(operatorRules, decls, source);
        LOG.debug(
                "Built rule schema: source={}, operators={}, datafields={}",
                source,
                schema.operatorCount(),
                schema.datafieldCount());
        return schema;
    }

    /**
     * Parses and validates an operator table. The keys {@code and}, {@code or} and {@code not} are stored as
     * {@code &&}, {@code ||} and {@code !}, the tokens the extractor reports; declaring both spellings is an error.
     */
    public Map<String, OperatorRule> parseOperators(JsonNode table, String source) {
        validateStructure(operatorTableSchema, table, "operator table", source);
        Map<String, OperatorRule> rules = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : table.properties()) {
            String name = OPERATOR_ALIASES.getOrDefault(entry.getKey(), entry.getKey());
            if (rules.containsKey(name)) {
                throw new RuleSchemaException(
                        "Operator '" + entry.getKey() + "' is declared more than once (as '" + name + "')", source);
            }
            try {
                rules.put(name, parseOperator(entry.getValue()));
            } catch (RuleSchemaException e) {
                throw new RuleSchemaException(
                        "Invalid rule for operator '" + name + "': " + e.getMessage(), e, source);
            }
        }
        return rules;
    }

    /** Parses and validates a datafield table. */
    public List<DatafieldDecl> parseDatafields(JsonNode table, String source) {
        validateStructure(datafieldTableSchema, table, "datafield table", source);
        List<DatafieldDecl> decls = new ArrayList<>();
        for (JsonNode entry : table) {
            String id = entry.get("id").asText();
            try {
                decls.add(new DatafieldDecl(id, DatafieldKind.fromId(entry.get("type").asText())));
            } catch (RuleSchemaException e) {
                throw new RuleSchemaException(
                        "Invalid declaration for datafield '" + id + "': " + e.getMessage(), e, source);
            }
        }
        return decls;
    }

    private OperatorRule parseOperator(JsonNode node) {
        int minArgs = node.path("min_args").asInt(0);
        int maxArgs = node.path("max_args").asInt(OperatorRule.UNBOUNDED);
        Map<String, KwargRule> kwargs = new LinkedHashMap<>();
        JsonNode kwargsNode = node.get("kwargs");
        if (kwargsNode != null && kwargsNode.isObject()) {
            for (Map.Entry<String, JsonNode> kwarg : kwargsNode.properties()) {
                try {
                    kwargs.put(kwarg.getKey(), parseKwarg(kwarg.getValue()));
                } catch (RuleSchemaException e) {
                    throw new RuleSchemaException("kwarg '" + kwarg.getKey() + "': " + e.getMessage(), e, null);
                }
            }
        }
        return new OperatorRule(minArgs, maxArgs, kwargs);
    }

    private KwargRule parseKwarg(JsonNode node) {
        KwargType type = KwargType.fromId(node.get("type").asText());
        List<Object> allowed = new ArrayList<>();
        JsonNode allowedNode = node.get("allowed");
        if (allowedNode != null && allowedNode.isArray()) {
            for (JsonNode value : allowedNode) {
                allowed.add(literalValue(value));
            }
        }
        return new KwargRule(
                type,
                allowed,
                optionalDouble(node, "min_val"),
                optionalDouble(node, "max_val"),
                node.path("min_inclusive").asBoolean(true),
                node.path("max_inclusive").asBoolean(true));
    }

    private static Object literalValue(JsonNode value) {
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        return value.asText();
    }

    private static Double optionalDouble(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.doubleValue();
    }

    private static RuleSchema build(Map<String, OperatorRule> operators, List<DatafieldDecl> decls, String source) {
        try {
            return RuleSchema.of(operators, decls);
        } catch (RuleSchemaException e) {
            throw new RuleSchemaException(e.getMessage(), e, source);
        }
    }

    private void validateStructure(JsonSchema schema, JsonNode table, String tableName, String source) {
        Set<ValidationMessage> errors = schema.validate(table);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            String where = source != null ? " in " + source : "";
            throw new RuleSchemaException("Malformed " + tableName + where + ": " + detail, source);
        }
    }

    private static JsonNode readTree(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (InputStream in = Files.newInputStream(path)) {
            JsonNode root = mapper.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new RuleSchemaException("Rule table is empty: " + path, path.toString());
            }
            return root;
        } catch (IOException e) {
            throw new RuleSchemaException(
                    "Failed to read or parse rule table " + path + ": " + e.getMessage(), e, path.toString());
        }
    }

    private static JsonSchema loadSchema(String resource) {
        try (InputStream in = RuleSchemaParser.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled JSON Schema not found on classpath: " + resource);
            }
            return SCHEMA_FACTORY.getSchema(JSON_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load bundled JSON Schema " + resource, e);
        }
    }
}
