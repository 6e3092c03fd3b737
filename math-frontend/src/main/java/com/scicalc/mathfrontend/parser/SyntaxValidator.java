package com.scicalc.mathfrontend.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.scicalc.mathfrontend.ast.BinaryOperator;

/**
 * Advisory diagnostics for as-you-type feedback. Never blocks evaluation: a non-empty
 * result only tells the caller where to draw squiggles.
 */
public final class SyntaxValidator {

    private SyntaxValidator() {
    }

    public static List<SyntaxError> validate(String expression) {
        List<SyntaxError> errors = new ArrayList<>();

        List<PositionedToken> tokens;
        try {
            tokens = Tokenizer.tokenize(expression);
        } catch (ParserException e) {
            errors.add(fromLexicalError(e));
            return errors;
        }

        errors.addAll(findUnmatchedParentheses(tokens));
        errors.addAll(findSequentialOperators(tokens));

        try {
            new Parser(tokens).parse();
        } catch (ParserException e) {
            SyntaxError structural = fromStructuralError(e, expression);
            if (structural != null && errors.stream().noneMatch(err -> err.getPosition() == structural.getPosition())) {
                errors.add(structural);
            }
        }

        return errors;
    }

    private static SyntaxError fromLexicalError(ParserException e) {
        String text = e.getText();
        switch (e.getKind()) {
            case INVALID_CHARACTER:
                return new SyntaxError("Invalid character '" + text + "'", e.getPosition(), text.length());
            case INVALID_NUMBER:
                return new SyntaxError("Invalid number '" + text + "'", e.getPosition(), text.length());
            default:
                return new SyntaxError(e.getMessage(), Math.max(0, e.getPosition()), 1);
        }
    }

    // unmatched parentheses are already reported by the balance pass
    private static SyntaxError fromStructuralError(ParserException e, String expression) {
        switch (e.getKind()) {
            case UNEXPECTED_TOKEN:
                return new SyntaxError("Unexpected " + e.getText(), e.getPosition(), 1);
            case UNEXPECTED_END_OF_INPUT:
                return new SyntaxError("Expected " + e.getExpected(), Math.max(0, expression.length() - 1), 1);
            default:
                return null;
        }
    }

    private static List<SyntaxError> findUnmatchedParentheses(List<PositionedToken> tokens) {
        List<SyntaxError> errors = new ArrayList<>();
        Deque<PositionedToken> open = new ArrayDeque<>();

        for (PositionedToken token : tokens) {
            if (token.getType() == TokenType.LEFT_PAREN) {
                open.push(token);
            } else if (token.getType() == TokenType.RIGHT_PAREN) {
                if (open.isEmpty()) {
                    errors.add(new SyntaxError("Extra closing parenthesis", token.getPosition().getOffset(), 1));
                } else {
                    open.pop();
                }
            }
        }

        // report leftovers left to right
        List<PositionedToken> unclosed = new ArrayList<>(open);
        for (int i = unclosed.size() - 1; i >= 0; i--) {
            errors.add(new SyntaxError("Missing closing parenthesis", unclosed.get(i).getPosition().getOffset(), 1));
        }
        return errors;
    }

    private static List<SyntaxError> findSequentialOperators(List<PositionedToken> tokens) {
        List<SyntaxError> errors = new ArrayList<>();

        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token first = tokens.get(i).getToken();
            PositionedToken next = tokens.get(i + 1);
            if (first.getType() != TokenType.BINARY_OPERATOR || next.getType() != TokenType.BINARY_OPERATOR) {
                continue;
            }
            if (isSign(next.getToken()) && !isSign(first)) {
                // 5*-2, 2^-1, x=-3
                continue;
            }
            errors.add(new SyntaxError("Two operators in a row", next.getPosition().getOffset(), 1));
        }
        return errors;
    }

    private static boolean isSign(Token token) {
        return token.isOperator(BinaryOperator.ADD) || token.isOperator(BinaryOperator.SUBTRACT);
    }
}
