package io.exprgate.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Structural summary of one expression, produced by {@code ExpressionExtractor}.
 *
 * <p>{@code operators} and {@code datafields} are unique and in order of first appearance. The {@code *Uses} lists
 * keep every occurrence in pre-order. {@code callSites} is indexed by {@link CallSite#index()}.
 *
 * <p>Immutable.
 */
public record Extraction(
        List<String> operators,
        List<String> datafields,
        List<CallSite> callSites,
        List<OperatorUse> operatorUses,
        List<DatafieldUse> datafieldUses,
        List<String> localNames) {

    public Extraction {
        operators = List.copyOf(operators);
        datafields = List.copyOf(datafields);
        callSites = List.copyOf(callSites);
        operatorUses = List.copyOf(operatorUses);
        datafieldUses = List.copyOf(datafieldUses);
        localNames = List.copyOf(localNames);
    }

    public static Extraction empty() {
        return new Extraction(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public CallSite callSite(int index) {
        return callSites.get(index);
    }

    /** First occurrence of the given operator token, if any. */
    public OperatorUse firstUseOf(String token) {
        Objects.requireNonNull(token, "token must not be null");
        for (OperatorUse use : operatorUses) {
            if (use.token().equals(token)) {
                return use;
            }
        }
        return null;
    }

    /** First occurrence of the given datafield, if any. */
    public DatafieldUse firstUseOfDatafield(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (DatafieldUse use : datafieldUses) {
            if (use.name().equals(name)) {
                return use;
            }
        }
        return null;
    }
}
