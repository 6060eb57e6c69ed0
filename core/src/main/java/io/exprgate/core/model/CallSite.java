package io.exprgate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One function invocation with its resolved arguments.
 *
 * <p>{@code index} is the call's pre-order position in the whole expression: in {@code f(g(x)); h(y)} the calls
 * {@code f}, {@code g}, {@code h} have indexes 0, 1, 2. A keyword repeated inside the call keeps its last value in
 * {@link #keywords()} and is listed once in {@link #duplicateKeywords()}.
 *
 * <p>Immutable.
 */
public record CallSite(
        int index,
        String operator,
        List<ExprNode> positional,
        Map<String, ExprNode> keywords,
        List<String> duplicateKeywords,
        Position position) {

    public CallSite {
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(position, "position must not be null");
        positional = List.copyOf(positional);
        keywords = Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
        duplicateKeywords = List.copyOf(duplicateKeywords);
    }

    /** Builds a call site from a parsed call node, resolving keyword repeats. */
    public static CallSite of(int index, ExprNode.Call call) {
        Map<String, ExprNode> keywords = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (ExprNode.Keyword keyword : call.keywords()) {
            if (keywords.put(keyword.name(), keyword.value()) != null && !duplicates.contains(keyword.name())) {
                duplicates.add(keyword.name());
            }
        }
        return new CallSite(index, call.function(), call.args(), keywords, duplicates, call.position());
    }

    public int positionalCount() {
        return positional.size();
    }
}
