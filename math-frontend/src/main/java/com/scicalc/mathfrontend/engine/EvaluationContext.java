package com.scicalc.mathfrontend.engine;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable variable bindings for one evaluation. Names are stored lower-cased,
 * matching how the tokenizer reads identifiers.
 */
public final class EvaluationContext {

    private static final EvaluationContext EMPTY = new EvaluationContext(Collections.emptyMap());

    private final Map<String, Double> bindings;

    private EvaluationContext(Map<String, Double> bindings) {
        this.bindings = bindings;
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException when two names differ only in case, e.g. {@code X} and {@code x}
     */
    public static EvaluationContext withBindings(Map<String, Double> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            return EMPTY;
        }
        Map<String, Double> copy = new HashMap<>();
        for (Map.Entry<String, Double> binding : bindings.entrySet()) {
            String name = binding.getKey().toLowerCase(Locale.ROOT);
            if (copy.containsKey(name)) {
                throw new IllegalArgumentException("Variable '" + name + "' is bound more than once");
            }
            copy.put(name, binding.getValue());
        }
        return new EvaluationContext(Collections.unmodifiableMap(copy));
    }

    public Double lookup(String name) {
        return bindings.get(name);
    }
}
