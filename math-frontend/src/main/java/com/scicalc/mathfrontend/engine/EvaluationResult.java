package com.scicalc.mathfrontend.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of evaluating an AST: a number, a symbolic answer, an error or a
 * not-implemented notice. Only {@link Type#NUMBER} and {@link Type#SYMBOLIC} count as success.
 */
public final class EvaluationResult {

    public enum Type { NUMBER, SYMBOLIC, ERROR, NOT_IMPLEMENTED }

    private final Type type;
    private final double number;
    private final String text;
    private final String latex;
    private final Map<String, Double> metadata;
    private final EvaluationIssue issue;

    private EvaluationResult(Type type, double number, String text, String latex,
                             Map<String, Double> metadata, EvaluationIssue issue) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.latex = latex;
        this.metadata = metadata;
        this.issue = issue;
    }

    public static EvaluationResult number(double value) {
        return new EvaluationResult(Type.NUMBER, value, null, null, null, null);
    }

    /**
     * @param metadata optional timings in milliseconds, keyed {@code conversion} and {@code python}
     */
    public static EvaluationResult symbolic(String result, String latex, Map<String, Double> metadata) {
        Map<String, Double> copy = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        return new EvaluationResult(Type.SYMBOLIC, Double.NaN, result, latex, copy, null);
    }

    public static EvaluationResult error(String message) {
        return error(message, null);
    }

    public static EvaluationResult error(String message, EvaluationIssue issue) {
        return new EvaluationResult(Type.ERROR, Double.NaN, message, null, null, issue);
    }

    public static EvaluationResult notImplemented(String message) {
        return new EvaluationResult(Type.NOT_IMPLEMENTED, Double.NaN, message, null, null, null);
    }

    public Type getType() { return type; }

    public boolean isSuccess() {
        return type == Type.NUMBER || type == Type.SYMBOLIC;
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    public boolean hasIssue(EvaluationIssue candidate) {
        return type == Type.ERROR && issue == candidate;
    }

    /** Numeric value; NaN unless this is a {@link Type#NUMBER} result. */
    public double getNumber() { return number; }

    /** Symbolic result text, or the message of an error / not-implemented result. */
    public String getText() { return text; }

    public String getLatex() { return latex; }
    public Map<String, Double> getMetadata() { return metadata; }
    public EvaluationIssue getIssue() { return issue; }

    public String getErrorMessage() {
        return type == Type.ERROR || type == Type.NOT_IMPLEMENTED ? text : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationResult other)) return false;
        return type == other.type && Double.compare(number, other.number) == 0 && Objects.equals(text, other.text)
                && Objects.equals(latex, other.latex) && Objects.equals(metadata, other.metadata) && issue == other.issue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, latex, metadata, issue);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER: return "Number(" + number + ")";
            case SYMBOLIC: return "Symbolic(" + text + ", " + latex + ")";
            case ERROR: return "Error(" + text + (issue != null ? ", " + issue : "") + ")";
            default: return "NotImplemented(" + text + ")";
        }
    }
}
