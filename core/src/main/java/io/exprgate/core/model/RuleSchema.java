package io.exprgate.core.model;

import io.exprgate.core.error.RuleSchemaException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable operator and datafield tables. Built once, then shared freely across threads; nothing mutates it
 * after {@link Builder#build()}.
 *
 * <p>Lookups are pure and case-sensitive. An operator or datafield with no entry is invalid by absence.
 */
public final class RuleSchema {

    private final Map<String, OperatorRule> operators;
    private final Map<String, DatafieldDecl> datafields;

    private RuleSchema(Map<String, OperatorRule> operators, Map<String, DatafieldDecl> datafields) {
        this.operators = Collections.unmodifiableMap(operators);
        this.datafields = Collections.unmodifiableMap(datafields);
    }

    /**
     * Builds a schema from an operator table and an ordered datafield list.
     *
     * @throws RuleSchemaException if a datafield id is declared twice
     */
    public static RuleSchema of(Map<String, OperatorRule> operators, List<DatafieldDecl> datafields) {
        Builder builder = builder();
        operators.forEach(builder::operator);
        datafields.forEach(builder::datafield);
        return builder.build();
    }

    public static RuleSchema empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<OperatorRule> lookupOperator(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    public Optional<DatafieldDecl> lookupDatafield(String id) {
        return Optional.ofNullable(datafields.get(id));
    }

    public boolean hasOperator(String name) {
        return operators.containsKey(name);
    }

    public boolean hasDatafield(String id) {
        return datafields.containsKey(id);
    }

    /** Operator names in declaration order. */
    public List<String> operatorNames() {
        return List.copyOf(operators.keySet());
    }

    /** Datafield declarations in declaration order. */
    public List<DatafieldDecl> datafields() {
        return List.copyOf(datafields.values());
    }

    public int operatorCount() {
        return operators.size();
    }

    public int datafieldCount() {
        return datafields.size();
    }

    @Override
    public String toString() {
        return "RuleSchema[operators=" + operators.size() + ", datafields=" + datafields.size() + "]";
    }

    /** Builder for {@link RuleSchema}. Not thread-safe; duplicates are reported by {@link #build()}. */
    public static final class Builder {

        private final Map<String, OperatorRule> operators = new LinkedHashMap<>();
        private final Map<String, DatafieldDecl> datafields = new LinkedHashMap<>();
        private final List<String> duplicateOperators = new ArrayList<>();
        private final List<String> duplicateDatafields = new ArrayList<>();

        private Builder() {}

        public Builder operator(String name, OperatorRule rule) {
            if (name == null || name.isBlank()) {
                throw new RuleSchemaException("Operator name must not be null or blank");
            }
            Objects.requireNonNull(rule, "rule must not be null");
            if (operators.put(name, rule) != null) {
                duplicateOperators.add(name);
            }
            return this;
        }

        public Builder datafield(DatafieldDecl decl) {
            Objects.requireNonNull(decl, "decl must not be null");
            if (datafields.put(decl.id(), decl) != null) {
                duplicateDatafields.add(decl.id());
            }
            return this;
        }

        public Builder datafield(String id, DatafieldKind kind) {
            return datafield(new DatafieldDecl(id, kind));
        }

        /**
         * @throws RuleSchemaException if an operator name or datafield id was declared more than once
         */
        public RuleSchema build() {
            if (!duplicateOperators.isEmpty()) {
                throw new RuleSchemaException("Duplicate operator name(s): " + duplicateOperators);
            }
            if (!duplicateDatafields.isEmpty()) {
                throw new RuleSchemaException("Duplicate datafield id(s): " + duplicateDatafields);
            }
            return new RuleSchema(new LinkedHashMap<>(operators), new LinkedHashMap<>(datafields));
        }
    }
}
