package com.scicalc.mathfrontend.parser;

public enum TokenType {
    NUMBER, BINARY_OPERATOR, LEFT_PAREN, RIGHT_PAREN, FUNCTION, CONSTANT, VARIABLE, EOF
}
