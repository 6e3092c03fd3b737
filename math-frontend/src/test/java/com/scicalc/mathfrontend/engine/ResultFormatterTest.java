package com.scicalc.mathfrontend.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ResultFormatterTest {

    @Test
    void integersHaveNoDecimals() {
        assertThat(ResultFormatter.format(14.0)).isEqualTo("14");
        assertThat(ResultFormatter.format(0.0)).isEqualTo("0");
        assertThat(ResultFormatter.format(-3.0)).isEqualTo("-3");
    }

    @Test
    void decimalsAreTrimmed() {
        assertThat(ResultFormatter.format(0.1 + 0.2)).isEqualTo("0.3");
        assertThat(ResultFormatter.format(-2.5)).isEqualTo("-2.5");
        assertThat(ResultFormatter.format(1.0 / 3)).isEqualTo("0.3333333333");
    }

    @Test
    void extremeMagnitudesUseScientificNotation() {
        assertThat(ResultFormatter.format(1e10)).isEqualTo("1E10");
        assertThat(ResultFormatter.format(1.5e-7)).isEqualTo("1.5E-7");
    }

    @Test
    void specialValues() {
        assertThat(ResultFormatter.format(Double.NaN)).isEqualTo("NaN");
        assertThat(ResultFormatter.format(Double.POSITIVE_INFINITY)).isEqualTo("∞");
        assertThat(ResultFormatter.format(Double.NEGATIVE_INFINITY)).isEqualTo("-∞");
    }

    @Test
    void formatsEachResultType() {
        assertThat(ResultFormatter.formatResult(EvaluationResult.number(2.5))).isEqualTo("2.5");
        assertThat(ResultFormatter.formatResult(EvaluationResult.symbolic("7/2", "\\frac{7}{2}", null)))
                .isEqualTo("7/2\n(7)/(2)");
        assertThat(ResultFormatter.formatResult(EvaluationResult.error("Division by zero")))
                .isEqualTo("Error: Division by zero");
        assertThat(ResultFormatter.formatResult(EvaluationResult.notImplemented("later")))
                .isEqualTo("Not Implemented: later");
    }

    @Test
    void metricsMentionSymbolicTimingsOnlyWhenPresent() {
        EvaluationMetrics numeric = new EvaluationMetrics(0.1, 0.2, 0.3, 1.0, 5, 9, null, null);
        EvaluationMetrics symbolic = new EvaluationMetrics(0.1, 0.2, 0.3, 1.0, 5, 9, 12.5, 0.05);

        assertThat(ResultFormatter.formatMetrics(numeric)).contains("AST Nodes: 5").doesNotContain("Python");
        assertThat(ResultFormatter.formatMetrics(symbolic)).contains("Python: 12.500 ms").contains("Conversion: 0.050 ms");
    }
}
