package com.scicalc.mathfrontend.engine;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import com.scicalc.mathfrontend.symbolic.LatexFormatter;

/**
 * Display formatting for results and metrics. The engines never round; this is the
 * only place numbers are shortened.
 */
public final class ResultFormatter {

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.ROOT);

    private ResultFormatter() {
    }

    public static String formatResult(EvaluationResult result) {
        switch (result.getType()) {
            case NUMBER:
                return format(result.getNumber());
            case SYMBOLIC:
                return result.getText() + "\n" + LatexFormatter.format(result.getLatex());
            case ERROR:
                return "Error: " + result.getText();
            default:
                return "Not Implemented: " + result.getText();
        }
    }

    public static String format(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "∞" : "-∞";

        double abs = Math.abs(value);
        if (abs != 0 && (abs >= 1e10 || abs < 1e-6)) {
            // DecimalFormat is not thread-safe, so one per call
            return new DecimalFormat("0.#########E0", SYMBOLS).format(value);
        }
        if (value == Math.rint(value)) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return new DecimalFormat("0.##########", SYMBOLS).format(value);
    }

    public static String formatMetrics(EvaluationMetrics metrics) {
        StringBuilder text = new StringBuilder();
        text.append(String.format(Locale.ROOT, "Parse: %.3f ms%n", metrics.getParseTimeMs()));
        text.append(String.format(Locale.ROOT, "Eval:  %.3f ms%n", metrics.getEvalTimeMs()));
        text.append(String.format(Locale.ROOT, "Total: %.3f ms%n", metrics.getTotalTimeMs()));
        text.append(String.format(Locale.ROOT, "Memory: %.2f KB%n", metrics.getMemoryDeltaKb()));
        text.append("AST Nodes: ").append(metrics.getAstNodeCount()).append(System.lineSeparator());
        text.append("Expr Length: ").append(metrics.getExpressionLength());
        if (metrics.getSymbolicCallTimeMs() != null) {
            text.append(String.format(Locale.ROOT, "%nPython: %.3f ms", metrics.getSymbolicCallTimeMs()));
        }
        if (metrics.getConversionTimeMs() != null) {
            text.append(String.format(Locale.ROOT, "%nConversion: %.3f ms", metrics.getConversionTimeMs()));
        }
        return text.toString();
    }
}
