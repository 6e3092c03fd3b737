package com.scicalc.mathfrontend.engine;

public class EvaluationReport {

    private final EvaluationResult result;
    private final EvaluationMetrics metrics;

    public EvaluationReport(EvaluationResult result, EvaluationMetrics metrics) {
        this.result = result;
        this.metrics = metrics;
    }

    public EvaluationResult getResult() { return result; }
    public EvaluationMetrics getMetrics() { return metrics; }

    public boolean isSuccess() {
        return result.isSuccess();
    }

    /** Display form of the result, e.g. {@code 14} or {@code Error: Division by zero}. */
    public String getResultString() {
        return ResultFormatter.formatResult(result);
    }
}
