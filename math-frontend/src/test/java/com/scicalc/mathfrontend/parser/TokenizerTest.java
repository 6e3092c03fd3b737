package com.scicalc.mathfrontend.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.scicalc.mathfrontend.ast.BinaryOperator;
import com.scicalc.mathfrontend.ast.MathConstant;
import com.scicalc.mathfrontend.ast.MathFunction;
import com.scicalc.mathfrontend.ast.SourcePosition;

class TokenizerTest {

    private static List<TokenType> types(List<PositionedToken> tokens) {
        return tokens.stream().map(PositionedToken::getType).collect(Collectors.toList());
    }

    @Test
    void tokenizesMixedExpression() throws ParserException {
        List<PositionedToken> tokens = Tokenizer.tokenize("3.14 * sin(x) + pi");

        assertThat(types(tokens)).containsExactly(
                TokenType.NUMBER, TokenType.BINARY_OPERATOR, TokenType.FUNCTION, TokenType.LEFT_PAREN,
                TokenType.VARIABLE, TokenType.RIGHT_PAREN, TokenType.BINARY_OPERATOR, TokenType.CONSTANT,
                TokenType.EOF);
        assertThat(tokens.get(0).getToken().getNumber()).isEqualTo(3.14);
        assertThat(tokens.get(1).getToken().getOperator()).isEqualTo(BinaryOperator.MULTIPLY);
        assertThat(tokens.get(2).getToken().getFunction()).isEqualTo(MathFunction.SIN);
        assertThat(tokens.get(4).getToken().getName()).isEqualTo("x");
        assertThat(tokens.get(7).getToken().getConstant()).isEqualTo(MathConstant.PI);
    }

    @Test
    void recordsOffsetsAndLengths() throws ParserException {
        List<PositionedToken> tokens = Tokenizer.tokenize("12 + 345");

        assertThat(tokens.get(0).getPosition()).isEqualTo(new SourcePosition(0, 2));
        assertThat(tokens.get(1).getPosition()).isEqualTo(new SourcePosition(3, 1));
        assertThat(tokens.get(2).getPosition()).isEqualTo(new SourcePosition(5, 3));
        assertThat(tokens.get(3).getType()).isEqualTo(TokenType.EOF);
        assertThat(tokens.get(3).getPosition().getOffset()).isEqualTo(8);
    }

    @Test
    void emptyInputYieldsOnlyEof() throws ParserException {
        assertThat(types(Tokenizer.tokenize(""))).containsExactly(TokenType.EOF);
        assertThat(types(Tokenizer.tokenize("   "))).containsExactly(TokenType.EOF);
        assertThat(types(Tokenizer.tokenize(null))).containsExactly(TokenType.EOF);
    }

    @Test
    void identifiersAreCaseInsensitive() throws ParserException {
        List<PositionedToken> tokens = Tokenizer.tokenize("SQRT(X) + PI");

        assertThat(tokens.get(0).getToken().getFunction()).isEqualTo(MathFunction.SQRT);
        assertThat(tokens.get(2).getToken().getName()).isEqualTo("x");
        assertThat(tokens.get(5).getToken().getConstant()).isEqualTo(MathConstant.PI);
    }

    @Test
    void scansScientificNotation() throws ParserException {
        assertThat(Tokenizer.tokenize("2e3").get(0).getToken().getNumber()).isEqualTo(2000.0);
        assertThat(Tokenizer.tokenize("1.5E-2").get(0).getToken().getNumber()).isEqualTo(0.015);
        assertThat(Tokenizer.tokenize(".5").get(0).getToken().getNumber()).isEqualTo(0.5);
    }

    @Test
    void trailingExponentMarkerIsEulersNumber() throws ParserException {
        List<PositionedToken> tokens = Tokenizer.tokenize("2e");

        assertThat(types(tokens)).containsExactly(TokenType.NUMBER, TokenType.CONSTANT, TokenType.EOF);
        assertThat(tokens.get(1).getToken().getConstant()).isEqualTo(MathConstant.E);
    }

    @Test
    void secondDecimalPointStartsNewNumber() throws ParserException {
        List<PositionedToken> tokens = Tokenizer.tokenize("1.2.3");

        assertThat(types(tokens)).containsExactly(TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF);
        assertThat(tokens.get(0).getToken().getNumber()).isEqualTo(1.2);
        assertThat(tokens.get(1).getToken().getNumber()).isEqualTo(0.3);
    }

    @Test
    void rejectsUnknownCharacter() {
        assertThatThrownBy(() -> Tokenizer.tokenize("2 $ 3"))
                .isInstanceOfSatisfying(ParserException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ParserException.Kind.INVALID_CHARACTER);
                    assertThat(e.getPosition()).isEqualTo(2);
                    assertThat(e.getText()).isEqualTo("$");
                });
    }

    @Test
    void rejectsLoneDecimalPoint() {
        assertThatThrownBy(() -> Tokenizer.tokenize("."))
                .isInstanceOfSatisfying(ParserException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ParserException.Kind.INVALID_NUMBER));
    }
}
