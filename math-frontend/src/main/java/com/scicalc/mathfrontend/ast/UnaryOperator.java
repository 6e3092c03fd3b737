package com.scicalc.mathfrontend.ast;

public enum UnaryOperator {
    NEGATE("-"),
    POSITIVE("+");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() { return symbol; }
}
