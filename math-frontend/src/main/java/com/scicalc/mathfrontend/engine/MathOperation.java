package com.scicalc.mathfrontend.engine;

import java.util.Locale;

/**
 * What the caller wants done with an expression. Each operation is served by the
 * symbolic collaborator endpoint of the same name.
 */
public enum MathOperation {
    EVALUATE,
    SOLVE,
    DIFFERENTIATE,
    INTEGRATE,
    SIMPLIFY;

    public String endpoint() {
        return "/" + name().toLowerCase(Locale.ROOT);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient lookup for request payloads; null or blank means {@link #EVALUATE}. */
    public static MathOperation fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return EVALUATE;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
