package com.scicalc.mathfrontend.parser;

import java.util.Objects;

import com.scicalc.mathfrontend.ast.BinaryOperator;
import com.scicalc.mathfrontend.ast.MathConstant;
import com.scicalc.mathfrontend.ast.MathFunction;

/**
 * Lexical token. Only the payload field matching {@link #getType()} is set.
 */
public final class Token {

    private static final Token LEFT_PAREN = new Token(TokenType.LEFT_PAREN, 0, null, null, null, null);
    private static final Token RIGHT_PAREN = new Token(TokenType.RIGHT_PAREN, 0, null, null, null, null);
    private static final Token EOF = new Token(TokenType.EOF, 0, null, null, null, null);

    private final TokenType type;
    private final double number;
    private final BinaryOperator operator;
    private final MathFunction function;
    private final MathConstant constant;
    private final String name;

    private Token(TokenType type, double number, BinaryOperator operator, MathFunction function,
                  MathConstant constant, String name) {
        this.type = type;
        this.number = number;
        this.operator = operator;
        this.function = function;
        this.constant = constant;
        this.name = name;
    }

    public static Token number(double value) { return new Token(TokenType.NUMBER, value, null, null, null, null); }
    public static Token operator(BinaryOperator op) { return new Token(TokenType.BINARY_OPERATOR, 0, op, null, null, null); }
    public static Token leftParen() { return LEFT_PAREN; }
    public static Token rightParen() { return RIGHT_PAREN; }
    public static Token function(MathFunction f) { return new Token(TokenType.FUNCTION, 0, null, f, null, null); }
    public static Token constant(MathConstant c) { return new Token(TokenType.CONSTANT, 0, null, null, c, null); }
    public static Token variable(String name) { return new Token(TokenType.VARIABLE, 0, null, null, null, name); }
    public static Token eof() { return EOF; }

    public TokenType getType() { return type; }
    public double getNumber() { return number; }
    public BinaryOperator getOperator() { return operator; }
    public MathFunction getFunction() { return function; }
    public MathConstant getConstant() { return constant; }
    public String getName() { return name; }

    public boolean isOperator(BinaryOperator op) {
        return type == TokenType.BINARY_OPERATOR && operator == op;
    }

    /** Whether this token can begin a prefix term, which is what makes implicit multiplication possible. */
    public boolean canStartPrefix() {
        switch (type) {
            case NUMBER: case LEFT_PAREN: case FUNCTION: case CONSTANT: case VARIABLE:
                return true;
            case BINARY_OPERATOR:
                return operator == BinaryOperator.ADD || operator == BinaryOperator.SUBTRACT;
            default:
                return false;
        }
    }

    /** Human-readable form used in parser diagnostics. */
    public String describe() {
        switch (type) {
            case NUMBER: return "number " + number;
            case BINARY_OPERATOR: return "'" + operator.getSymbol() + "'";
            case LEFT_PAREN: return "'('";
            case RIGHT_PAREN: return "')'";
            case FUNCTION: return "function '" + function.functionName() + "'";
            case CONSTANT: return "constant '" + constant.constantName() + "'";
            case VARIABLE: return "variable '" + name + "'";
            default: return "end of input";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token other)) return false;
        return type == other.type && Double.compare(number, other.number) == 0 && operator == other.operator
                && function == other.function && constant == other.constant && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, operator, function, constant, name);
    }

    @Override
    public String toString() {
        return "Token(" + type + ", " + describe() + ")";
    }
}
