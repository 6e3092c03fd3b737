package com.scicalc.mathfrontend.ast;

/**
 * Binary operators with their Pratt precedence (higher binds tighter).
 * Equals sits below everything else and is only meaningful at the top of an equation.
 */
public enum BinaryOperator {
    ADD("+", 10, false),
    SUBTRACT("-", 10, false),
    MULTIPLY("*", 20, false),
    DIVIDE("/", 20, false),
    POWER("^", 30, true),
    EQUALS("=", 0, false);

    private final String symbol;
    private final int precedence;
    private final boolean rightAssociative;

    BinaryOperator(String symbol, int precedence, boolean rightAssociative) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
    }

    public String getSymbol() { return symbol; }
    public int getPrecedence() { return precedence; }
    public boolean isRightAssociative() { return rightAssociative; }

    public static BinaryOperator fromSymbol(char c) {
        for (BinaryOperator op : values()) {
            if (op.symbol.charAt(0) == c) {
                return op;
            }
        }
        return null;
    }
}
