package com.scicalc.mathfrontend.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.scicalc.mathfrontend.ast.BinaryOperator;
import com.scicalc.mathfrontend.ast.MathConstant;
import com.scicalc.mathfrontend.ast.MathFunction;
import com.scicalc.mathfrontend.ast.SourcePosition;

/**
 * Splits an expression string into positioned tokens. One instance per input string;
 * the stream always ends with a single EOF token at the final offset.
 */
public class Tokenizer {

    private final String input;
    private int offset;

    public Tokenizer(String input) {
        this.input = input == null ? "" : input;
    }

    public static List<PositionedToken> tokenize(String input) throws ParserException {
        return new Tokenizer(input).tokenize();
    }

    public List<PositionedToken> tokenize() throws ParserException {
        List<PositionedToken> tokens = new ArrayList<>();
        offset = 0;

        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            int start = offset;
            Token token = scanToken();
            tokens.add(new PositionedToken(token, new SourcePosition(start, Math.max(1, offset - start))));
        }

        tokens.add(new PositionedToken(Token.eof(), new SourcePosition(offset, 0)));
        return tokens;
    }

    private boolean isAtEnd() {
        return offset >= input.length();
    }

    private char currentChar() {
        return isAtEnd() ? '\0' : input.charAt(offset);
    }

    private char peek(int ahead) {
        int i = offset + ahead;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private char advance() {
        char c = currentChar();
        if (!isAtEnd()) offset++;
        return c;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(currentChar())) {
            advance();
        }
    }

    private Token scanToken() throws ParserException {
        char c = currentChar();

        if (Character.isDigit(c) || c == '.') {
            return scanNumber();
        }
        if (Character.isLetter(c)) {
            return scanIdentifier();
        }

        advance();
        switch (c) {
            case '(': return Token.leftParen();
            case ')': return Token.rightParen();
            default:
                BinaryOperator op = BinaryOperator.fromSymbol(c);
                if (op == null) {
                    throw ParserException.invalidCharacter(c, offset - 1);
                }
                return Token.operator(op);
        }
    }

    private Token scanNumber() throws ParserException {
        int start = offset;
        boolean hasDecimal = false;
        boolean hasExponent = false;

        while (!isAtEnd()) {
            char c = currentChar();
            if (Character.isDigit(c)) {
                advance();
            } else if (c == '.' && !hasDecimal && !hasExponent) {
                hasDecimal = true;
                advance();
            } else if ((c == 'e' || c == 'E') && !hasExponent && offset > start && startsExponent()) {
                hasExponent = true;
                advance();
                if (currentChar() == '+' || currentChar() == '-') {
                    advance();
                }
            } else {
                break;
            }
        }

        String text = input.substring(start, offset);
        try {
            return Token.number(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw ParserException.invalidNumber(text, start);
        }
    }

    // the marker only belongs to the number when digits follow, so "2e" stays 2 times e
    private boolean startsExponent() {
        char next = peek(1);
        if (next == '+' || next == '-') {
            return Character.isDigit(peek(2));
        }
        return Character.isDigit(next);
    }

    private Token scanIdentifier() {
        int start = offset;
        while (!isAtEnd() && Character.isLetterOrDigit(currentChar())) {
            advance();
        }
        String identifier = input.substring(start, offset).toLowerCase(Locale.ROOT);

        MathFunction function = MathFunction.lookup(identifier);
        if (function != null) {
            return Token.function(function);
        }
        MathConstant constant = MathConstant.lookup(identifier);
        if (constant != null) {
            return Token.constant(constant);
        }
        return Token.variable(identifier);
    }
}
