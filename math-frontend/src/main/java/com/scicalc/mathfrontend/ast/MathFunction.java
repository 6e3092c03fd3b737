package com.scicalc.mathfrontend.ast;

import java.util.Locale;

/**
 * Built-in single-argument functions. {@link #LOG} is base 10, {@link #LN} is natural.
 */
public enum MathFunction {
    SIN, COS, TAN, LOG, LN, SQRT;

    public String functionName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; null when {@code name} is not a built-in function. */
    public static MathFunction lookup(String name) {
        for (MathFunction f : values()) {
            if (f.functionName().equalsIgnoreCase(name)) {
                return f;
            }
        }
        return null;
    }
}
