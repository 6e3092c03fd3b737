package com.scicalc.mathfrontend.nl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.scicalc.mathfrontend.engine.MathOperation;

class NLTranslatorTest {

    private final NLTranslator translator = new NLTranslator();

    private static NLTranslation translated(String expression) {
        return new NLTranslation(expression, MathOperation.EVALUATE, null, true);
    }

    @Test
    void squareRootPhrase() {
        assertThat(translator.translate("square root of 144")).isEqualTo(translated("sqrt(144)"));
    }

    @Test
    void derivativeDefaultsToX() {
        NLTranslation result = translator.translate("derivative of x^3");

        assertThat(result.getOperation()).isEqualTo(MathOperation.DIFFERENTIATE);
        assertThat(result.getVariable()).isEqualTo("x");
        assertThat(result.getExpression()).isEqualTo("x^3");
        assertThat(result.isDidTranslate()).isTrue();
    }

    @Test
    void derivativeWithRespectToVariable() {
        assertThat(translator.translate("derivative of sin(t) with respect to t"))
                .isEqualTo(new NLTranslation("sin(t)", MathOperation.DIFFERENTIATE, "t", true));
        assertThat(translator.translate("d/dy of y^2"))
                .isEqualTo(new NLTranslation("y^2", MathOperation.DIFFERENTIATE, "y", true));
    }

    @Test
    void integrals() {
        assertThat(translator.translate("integrate x^2 dx"))
                .isEqualTo(new NLTranslation("x^2", MathOperation.INTEGRATE, "x", true));
        assertThat(translator.translate("integral of sin(u) with respect to u"))
                .isEqualTo(new NLTranslation("sin(u)", MathOperation.INTEGRATE, "u", true));
        assertThat(translator.translate("antiderivative of cos(x)"))
                .isEqualTo(new NLTranslation("cos(x)", MathOperation.INTEGRATE, "x", true));
    }

    @Test
    void limits() {
        assertThat(translator.translate("limit of sin(x)/x as x approaches 0"))
                .isEqualTo(translated("limit(sin(x)/x, x, 0)"));
    }

    @Test
    void solving() {
        assertThat(translator.translate("solve 2x + 3 = 7 for x"))
                .isEqualTo(new NLTranslation("2x+3 = 7", MathOperation.SOLVE, "x", true));
        assertThat(translator.translate("find y in 2y = 4"))
                .isEqualTo(new NLTranslation("2y = 4", MathOperation.SOLVE, "y", true));
        assertThat(translator.translate("roots of x^2 - 4"))
                .isEqualTo(new NLTranslation("x^2-4", MathOperation.SOLVE, "x", true));
    }

    @Test
    void spokenEquationIsSolved() {
        assertThat(translator.translate("x plus 2 equals 5"))
                .isEqualTo(new NLTranslation("x+2 = 5", MathOperation.SOLVE, "x", true));
    }

    @Test
    void algebra() {
        assertThat(translator.translate("factor x^2 - 1"))
                .isEqualTo(new NLTranslation("factor(x^2-1)", MathOperation.SIMPLIFY, null, true));
        assertThat(translator.translate("expand (x+1)^2"))
                .isEqualTo(new NLTranslation("expand((x+1)^2)", MathOperation.SIMPLIFY, null, true));
    }

    @Test
    void statisticsAndLinearAlgebra() {
        assertThat(translator.translate("mean of 1, 2, 3")).isEqualTo(translated("mean([1, 2, 3])"));
        assertThat(translator.translate("standard deviation of 2, 4")).isEqualTo(translated("stdev([2, 4])"));
        assertThat(translator.translate("determinant of [[1, 2], [3, 4]]"))
                .isEqualTo(translated("det([[1, 2], [3, 4]])"));
    }

    @Test
    void percentages() {
        assertThat(translator.translate("15 percent of 200")).isEqualTo(translated("200 * 15 / 100"));
        assertThat(translator.translate("20% of 50")).isEqualTo(translated("50 * 20 / 100"));
    }

    @Test
    void roots() {
        assertThat(translator.translate("cube root of 27")).isEqualTo(translated("(27)^(1/3)"));
        assertThat(translator.translate("5th root of 32")).isEqualTo(translated("(32)^(1/5)"));
    }

    @Test
    void powers() {
        assertThat(translator.translate("2 to the power of 10")).isEqualTo(translated("(2)^(10)"));
        assertThat(translator.translate("3 squared")).isEqualTo(translated("(3)^2"));
        assertThat(translator.translate("4 cubed")).isEqualTo(translated("(4)^3"));
    }

    @Test
    void logarithms() {
        assertThat(translator.translate("log base 2 of 8")).isEqualTo(translated("log(8)/log(2)"));
        assertThat(translator.translate("natural log of 10")).isEqualTo(translated("ln(10)"));
        assertThat(translator.translate("log of 100")).isEqualTo(translated("log(100)"));
    }

    @Test
    void trigonometry() {
        assertThat(translator.translate("sine of 0")).isEqualTo(translated("sin(0)"));
        assertThat(translator.translate("cos of pi")).isEqualTo(translated("cos(pi)"));
        assertThat(translator.translate("tangent of 1")).isEqualTo(translated("tan(1)"));
    }

    @Test
    void arithmetic() {
        assertThat(translator.translate("what is 5 plus 3")).isEqualTo(translated("5+3"));
        assertThat(translator.translate("10 over 2")).isEqualTo(translated("10 / 2"));
        assertThat(translator.translate("calculate 10 divided by 2")).isEqualTo(translated("10/2"));
    }

    @Test
    void constantsFactorialAndAbsoluteValue() {
        assertThat(translator.translate("value of pi")).isEqualTo(translated("pi"));
        assertThat(translator.translate("euler's number")).isEqualTo(translated("E"));
        assertThat(translator.translate("5 factorial")).isEqualTo(translated("5!"));
        assertThat(translator.translate("factorial of 6")).isEqualTo(translated("6!"));
        assertThat(translator.translate("absolute value of -5")).isEqualTo(translated("abs(-5)"));
    }

    @Test
    void expressionsPassThroughUntouched() {
        assertThat(translator.translate("2 + 3 * 4")).isEqualTo(NLTranslation.passthrough("2 + 3 * 4"));
        assertThat(translator.translate("  sin(x) + 1 ")).isEqualTo(NLTranslation.passthrough("sin(x) + 1"));
        assertThat(translator.translate("42")).isEqualTo(NLTranslation.passthrough("42"));
    }

    @Test
    void typedEquationBecomesSolveRequest() {
        assertThat(translator.translate("2x = 10"))
                .isEqualTo(new NLTranslation("2x = 10", MathOperation.SOLVE, "x", true));
        assertThat(translator.translate("3*x - 5 = 16"))
                .isEqualTo(new NLTranslation("3*x-5 = 16", MathOperation.SOLVE, "x", true));
    }

    @Test
    void spelledOutArithmeticIsTranslatedNotPassedThrough() {
        assertThat(translator.translate("2 plus 3")).isEqualTo(translated("2+3"));
    }

    @Test
    void emptyInputIsEmptyPassthrough() {
        assertThat(translator.translate("")).isEqualTo(NLTranslation.passthrough(""));
        assertThat(translator.translate(null)).isEqualTo(NLTranslation.passthrough(""));
    }

    @Test
    void unmatchedTextFallsBackToCleanedExpression() {
        assertThat(translator.translate("x plus y")).isEqualTo(translated("x+y"));
    }

    @Test
    void typosAreCorrectedBeforeMatching() {
        assertThat(translator.translate("inetgrate x^2 dx"))
                .isEqualTo(new NLTranslation("x^2", MathOperation.INTEGRATE, "x", true));
    }

    @Test
    void expressionDetection() {
        assertThat(NLTranslator.looksLikeExpression("3*x - 5 = 16")).isTrue();
        assertThat(NLTranslator.looksLikeExpression("-2.5")).isTrue();
        assertThat(NLTranslator.looksLikeExpression("5 plus 3")).isFalse();
        assertThat(NLTranslator.looksLikeExpression("15% of 200")).isFalse();
    }
}
