package com.scicalc.mathfrontend.engine;

/**
 * Stable tag attached to evaluation errors so callers can branch on the failure class
 * instead of matching message text.
 */
public enum EvaluationIssue {
    DIVISION_BY_ZERO,
    OVERFLOW,
    DOMAIN_ERROR,
    CANNOT_EVALUATE_EQUALITY,
    UNDEFINED_VARIABLE,
    SYMBOLIC_COMPUTATION_REQUIRED
}
