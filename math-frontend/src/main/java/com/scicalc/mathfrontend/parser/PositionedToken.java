package com.scicalc.mathfrontend.parser;

import java.util.Objects;

import com.scicalc.mathfrontend.ast.SourcePosition;

public final class PositionedToken {

    private final Token token;
    private final SourcePosition position;

    public PositionedToken(Token token, SourcePosition position) {
        this.token = Objects.requireNonNull(token, "token");
        this.position = Objects.requireNonNull(position, "position");
    }

    public Token getToken() { return token; }
    public SourcePosition getPosition() { return position; }

    public TokenType getType() {
        return token.getType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PositionedToken other)) return false;
        return token.equals(other.token) && position.equals(other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, position);
    }

    @Override
    public String toString() {
        return token + "@" + position;
    }
}
