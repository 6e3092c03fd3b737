package com.scicalc.mathfrontend.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class SyntaxValidatorTest {

    @Test
    void wellFormedExpressionHasNoDiagnostics() {
        assertThat(SyntaxValidator.validate("2 + 3 * sin(x)")).isEmpty();
    }

    @Test
    void emptyInputHasNoDiagnostics() {
        assertThat(SyntaxValidator.validate("")).isEmpty();
    }

    @Test
    void unclosedParenthesisReportedOnceAtItsOffset() {
        List<SyntaxError> errors = SyntaxValidator.validate("(1 + 2");

        assertThat(errors).containsExactly(new SyntaxError("Missing closing parenthesis", 0, 1));
    }

    @Test
    void extraClosingParenthesisReportedOnce() {
        List<SyntaxError> errors = SyntaxValidator.validate("1 + 2)");

        assertThat(errors).containsExactly(new SyntaxError("Extra closing parenthesis", 5, 1));
    }

    @Test
    void unclosedParenthesesReportedLeftToRight() {
        List<SyntaxError> errors = SyntaxValidator.validate("((1");

        assertThat(errors).extracting(SyntaxError::getPosition).containsExactly(0, 1);
    }

    @Test
    void doubledSignIsFlagged() {
        List<SyntaxError> errors = SyntaxValidator.validate("5++4");

        assertThat(errors).containsExactly(new SyntaxError("Two operators in a row", 2, 1));
    }

    @Test
    void signAfterMultiplicationIsAllowed() {
        assertThat(SyntaxValidator.validate("5*-2")).isEmpty();
        assertThat(SyntaxValidator.validate("2^-1")).isEmpty();
        assertThat(SyntaxValidator.validate("x=-3")).isEmpty();
    }

    @Test
    void doubledMultiplicationIsFlagged() {
        List<SyntaxError> errors = SyntaxValidator.validate("2 * / 3");

        assertThat(errors).extracting(SyntaxError::getMessage).contains("Two operators in a row");
        assertThat(errors).extracting(SyntaxError::getPosition).contains(4);
    }

    @Test
    void danglingOperatorExpectsExpression() {
        List<SyntaxError> errors = SyntaxValidator.validate("2 +");

        assertThat(errors).containsExactly(new SyntaxError("Expected expression", 2, 1));
    }

    @Test
    void invalidCharacterStopsValidation() {
        List<SyntaxError> errors = SyntaxValidator.validate("2 $ 3");

        assertThat(errors).containsExactly(new SyntaxError("Invalid character '$'", 2, 1));
    }
}
