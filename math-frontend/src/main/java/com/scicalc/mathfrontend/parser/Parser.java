package com.scicalc.mathfrontend.parser;

import java.util.List;

import com.scicalc.mathfrontend.ast.BinaryOperator;
import com.scicalc.mathfrontend.ast.MathFunction;
import com.scicalc.mathfrontend.ast.Node;
import com.scicalc.mathfrontend.ast.SourcePosition;
import com.scicalc.mathfrontend.ast.UnaryOperator;

/**
 * Precedence-climbing (Pratt) parser. Each instance owns its own cursor over one token
 * stream, so a parser is never shared between calls.
 *
 * <p>Adjacent terms with no operator between them ({@code 2x}, {@code 2(3)}, {@code (a)(b)})
 * are joined by an implicit multiplication that binds like an explicit {@code *}.
 */
public class Parser {

    private static final PositionedToken END =
            new PositionedToken(Token.eof(), new SourcePosition(0, 0));

    private final List<PositionedToken> tokens;
    private int current = 0;

    public Parser(List<PositionedToken> tokens) {
        this.tokens = tokens;
    }

    /** Tokenizes and parses {@code expression} in one go. */
    public static Node parse(String expression) throws ParserException {
        return new Parser(Tokenizer.tokenize(expression)).parse();
    }

    public Node parse() throws ParserException {
        boolean empty = tokens.stream().allMatch(t -> t.getType() == TokenType.EOF);
        if (empty) {
            throw ParserException.emptyExpression();
        }

        Node node = parseExpression(0);

        if (!isAtEnd()) {
            PositionedToken leftover = currentToken();
            throw ParserException.unexpectedToken("end of expression",
                    leftover.getToken().describe(), leftover.getPosition().getOffset());
        }
        return node;
    }

    private Node parseExpression(int minPrecedence) throws ParserException {
        Node left = parsePrefix();

        while (!isAtEnd()) {
            Token token = currentToken().getToken();
            BinaryOperator op;
            boolean implicit = false;

            if (token.getType() == TokenType.BINARY_OPERATOR) {
                op = token.getOperator();
            } else if (token.canStartPrefix()) {
                op = BinaryOperator.MULTIPLY;
                implicit = true;
            } else {
                break;
            }

            if (op.getPrecedence() < minPrecedence) break;

            if (!implicit) {
                advance();
            }

            int nextPrecedence = op.isRightAssociative() ? op.getPrecedence() : op.getPrecedence() + 1;
            Node right = parseExpression(nextPrecedence);

            left = new Node.BinaryNode(left, op, right,
                    SourcePosition.spanning(left.getPosition(), right.getPosition()));
        }

        return left;
    }

    private Node parsePrefix() throws ParserException {
        PositionedToken positioned = currentToken();
        Token token = positioned.getToken();
        SourcePosition position = positioned.getPosition();

        switch (token.getType()) {
            case NUMBER:
                advance();
                return new Node.NumberNode(token.getNumber(), position);

            case CONSTANT:
                advance();
                return new Node.ConstantNode(token.getConstant(), position);

            case VARIABLE:
                advance();
                return new Node.VariableNode(token.getName(), position);

            case BINARY_OPERATOR:
                if (token.isOperator(BinaryOperator.SUBTRACT) || token.isOperator(BinaryOperator.ADD)) {
                    advance();
                    Node operand = parsePrefix();
                    UnaryOperator unary = token.isOperator(BinaryOperator.SUBTRACT)
                            ? UnaryOperator.NEGATE : UnaryOperator.POSITIVE;
                    return new Node.UnaryNode(unary, operand, SourcePosition.spanning(position, operand.getPosition()));
                }
                break;

            case FUNCTION:
                return parseFunction(token.getFunction(), position);

            case LEFT_PAREN:
                return parseGroup(position);

            case EOF:
                throw ParserException.unexpectedEndOfInput("expression", position.getOffset());

            default:
                break;
        }

        throw ParserException.unexpectedToken("number, function, or '('", token.describe(), position.getOffset());
    }

    private Node parseFunction(MathFunction function, SourcePosition start) throws ParserException {
        advance();

        PositionedToken open = currentToken();
        if (open.getType() != TokenType.LEFT_PAREN) {
            throw ParserException.unexpectedToken("'(' after function name",
                    open.getToken().describe(), open.getPosition().getOffset());
        }
        advance();

        Node argument = parseExpression(0);

        if (currentToken().getType() != TokenType.RIGHT_PAREN) {
            throw ParserException.unmatchedParenthesis(open.getPosition().getOffset());
        }
        PositionedToken close = advance();

        return new Node.FunctionNode(function, argument, SourcePosition.spanning(start, close.getPosition()));
    }

    private Node parseGroup(SourcePosition open) throws ParserException {
        advance();

        Node inner = parseExpression(0);

        if (currentToken().getType() != TokenType.RIGHT_PAREN) {
            throw ParserException.unmatchedParenthesis(open.getOffset());
        }
        advance();
        return inner;
    }

    private boolean isAtEnd() {
        return current >= tokens.size() || currentToken().getType() == TokenType.EOF;
    }

    private PositionedToken currentToken() {
        return current < tokens.size() ? tokens.get(current) : END;
    }

    private PositionedToken advance() {
        PositionedToken token = currentToken();
        if (current < tokens.size()) current++;
        return token;
    }
}
