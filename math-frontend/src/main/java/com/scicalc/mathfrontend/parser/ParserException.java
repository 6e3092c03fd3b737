package com.scicalc.mathfrontend.parser;

/**
 * Lexical or syntactic failure. {@link #getPosition()} is the offset of the offending
 * character or token, or -1 when the failure has no single location.
 */
public class ParserException extends Exception {

    public enum Kind {
        EMPTY_EXPRESSION,
        INVALID_NUMBER,
        INVALID_CHARACTER,
        /** Not raised by this parser: unknown names are read as variables. */
        UNKNOWN_IDENTIFIER,
        UNEXPECTED_TOKEN,
        UNEXPECTED_END_OF_INPUT,
        UNMATCHED_PARENTHESIS
    }

    private final Kind kind;
    private final int position;
    private final String text;
    private final String expected;

    private ParserException(Kind kind, String message, int position, String text, String expected) {
        super(message);
        this.kind = kind;
        this.position = position;
        this.text = text;
        this.expected = expected;
    }

    public static ParserException emptyExpression() {
        return new ParserException(Kind.EMPTY_EXPRESSION, "Empty expression", -1, "", null);
    }

    public static ParserException invalidNumber(String text, int position) {
        return new ParserException(Kind.INVALID_NUMBER,
                "Invalid number '" + text + "' at position " + position, position, text, null);
    }

    public static ParserException invalidCharacter(char c, int position) {
        return new ParserException(Kind.INVALID_CHARACTER,
                "Invalid character '" + c + "' at position " + position, position, String.valueOf(c), null);
    }

    public static ParserException unexpectedToken(String expected, String got, int position) {
        return new ParserException(Kind.UNEXPECTED_TOKEN,
                "Unexpected " + got + " at position " + position + ", expected " + expected, position, got, expected);
    }

    public static ParserException unexpectedEndOfInput(String expected, int position) {
        return new ParserException(Kind.UNEXPECTED_END_OF_INPUT,
                "Unexpected end of input, expected " + expected, position, "", expected);
    }

    public static ParserException unmatchedParenthesis(int position) {
        return new ParserException(Kind.UNMATCHED_PARENTHESIS,
                "Unmatched parenthesis at position " + position, position, "(", null);
    }

    public Kind getKind() { return kind; }
    public int getPosition() { return position; }

    /** Offending source text: the bad number, character, identifier or described token. */
    public String getText() { return text; }

    public String getExpected() { return expected; }
}
