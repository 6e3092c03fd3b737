package com.scicalc.mathfrontend.ast;

import java.util.Locale;

public enum MathConstant {
    PI(Math.PI),
    E(Math.E);

    private final double value;

    MathConstant(double value) {
        this.value = value;
    }

    public double getValue() { return value; }

    public String constantName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MathConstant lookup(String name) {
        for (MathConstant c : values()) {
            if (c.constantName().equalsIgnoreCase(name)) {
                return c;
            }
        }
        return null;
    }
}
