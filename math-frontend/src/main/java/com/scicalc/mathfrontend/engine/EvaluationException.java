package com.scicalc.mathfrontend.engine;

/**
 * Typed numeric failure raised inside the tree walk and turned into an
 * {@link EvaluationResult#error(String, EvaluationIssue)} at the engine boundary.
 */
public class EvaluationException extends Exception {

    private final EvaluationIssue issue;

    private EvaluationException(EvaluationIssue issue, String message) {
        super(message);
        this.issue = issue;
    }

    public static EvaluationException divisionByZero() {
        return new EvaluationException(EvaluationIssue.DIVISION_BY_ZERO, "Division by zero");
    }

    public static EvaluationException overflow() {
        return new EvaluationException(EvaluationIssue.OVERFLOW, "Numeric overflow");
    }

    public static EvaluationException domainError(String message) {
        return new EvaluationException(EvaluationIssue.DOMAIN_ERROR, message);
    }

    public static EvaluationException cannotEvaluateEquality() {
        return new EvaluationException(EvaluationIssue.CANNOT_EVALUATE_EQUALITY, "Cannot evaluate equality numerically");
    }

    public static EvaluationException undefinedVariable(String name) {
        return new EvaluationException(EvaluationIssue.UNDEFINED_VARIABLE, "Undefined variable: " + name);
    }

    public static EvaluationException symbolicComputationRequired(String detail) {
        return new EvaluationException(EvaluationIssue.SYMBOLIC_COMPUTATION_REQUIRED,
                "Symbolic computation required: " + detail);
    }

    public EvaluationIssue getIssue() { return issue; }
}
