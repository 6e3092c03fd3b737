package com.scicalc.mathfrontend.symbolic;

/**
 * Answer returned by the symbolic collaborator.
 */
public class SymbolicResult {

    private final String result;
    private final String latex;
    private final double executionTimeMs;

    public SymbolicResult(String result, String latex, double executionTimeMs) {
        this.result = result;
        this.latex = latex;
        this.executionTimeMs = executionTimeMs;
    }

    public String getResult() { return result; }
    public String getLatex() { return latex; }
    public double getExecutionTimeMs() { return executionTimeMs; }

    @Override
    public String toString() {
        return "SymbolicResult{" +
                "result='" + result + '\'' +
                ", latex='" + latex + '\'' +
                ", executionTimeMs=" + executionTimeMs +
                '}';
    }
}
