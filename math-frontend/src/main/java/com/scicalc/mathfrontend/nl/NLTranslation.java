package com.scicalc.mathfrontend.nl;

import java.util.Objects;

import com.scicalc.mathfrontend.engine.MathOperation;

/**
 * What a natural-language request boiled down to: an expression in calculator syntax,
 * the operation to run on it and, for calculus and solving, the variable.
 */
public final class NLTranslation {

    private final String expression;
    private final MathOperation operation;
    private final String variable;
    private final boolean didTranslate;

    public NLTranslation(String expression, MathOperation operation, String variable, boolean didTranslate) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.variable = variable;
        this.didTranslate = didTranslate;
    }

    /** Input that was already an expression, handed on untouched. */
    public static NLTranslation passthrough(String expression) {
        return new NLTranslation(expression, MathOperation.EVALUATE, null, false);
    }

    static NLTranslation evaluate(String expression) {
        return new NLTranslation(expression, MathOperation.EVALUATE, null, true);
    }

    public String getExpression() { return expression; }
    public MathOperation getOperation() { return operation; }
    public String getVariable() { return variable; }
    public boolean isDidTranslate() { return didTranslate; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NLTranslation other)) return false;
        return didTranslate == other.didTranslate && expression.equals(other.expression)
                && operation == other.operation && Objects.equals(variable, other.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, operation, variable, didTranslate);
    }

    @Override
    public String toString() {
        return "NLTranslation{expression='" + expression + "', operation=" + operation.label()
                + (variable != null ? ", variable=" + variable : "") + ", translated=" + didTranslate + "}";
    }
}
