package com.scicalc.mathfrontend.engine;

/**
 * Timings and sizes recorded for one dispatcher call. Times are milliseconds;
 * the symbolic fields are null unless the symbolic collaborator answered.
 */
public class EvaluationMetrics {

    private final double parseTimeMs;
    private final double evalTimeMs;
    private final double totalTimeMs;
    private final double memoryDeltaKb;
    private final int astNodeCount;
    private final int expressionLength;
    private final Double symbolicCallTimeMs;
    private final Double conversionTimeMs;

    public EvaluationMetrics(double parseTimeMs, double evalTimeMs, double totalTimeMs, double memoryDeltaKb,
                             int astNodeCount, int expressionLength, Double symbolicCallTimeMs, Double conversionTimeMs) {
        this.parseTimeMs = parseTimeMs;
        this.evalTimeMs = evalTimeMs;
        this.totalTimeMs = totalTimeMs;
        this.memoryDeltaKb = memoryDeltaKb;
        this.astNodeCount = astNodeCount;
        this.expressionLength = expressionLength;
        this.symbolicCallTimeMs = symbolicCallTimeMs;
        this.conversionTimeMs = conversionTimeMs;
    }

    public double getParseTimeMs() { return parseTimeMs; }
    public double getEvalTimeMs() { return evalTimeMs; }
    public double getTotalTimeMs() { return totalTimeMs; }
    public double getMemoryDeltaKb() { return memoryDeltaKb; }
    public int getAstNodeCount() { return astNodeCount; }
    public int getExpressionLength() { return expressionLength; }
    public Double getSymbolicCallTimeMs() { return symbolicCallTimeMs; }
    public Double getConversionTimeMs() { return conversionTimeMs; }
}
