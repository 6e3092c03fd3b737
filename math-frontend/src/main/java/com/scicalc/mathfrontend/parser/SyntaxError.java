package com.scicalc.mathfrontend.parser;

import java.util.Objects;

/**
 * One advisory diagnostic for live validation: what is wrong and which characters to underline.
 */
public final class SyntaxError {

    private final String message;
    private final int position;
    private final int length;

    public SyntaxError(String message, int position, int length) {
        this.message = message;
        this.position = position;
        this.length = length;
    }

    public String getMessage() { return message; }
    public int getPosition() { return position; }
    public int getLength() { return length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxError other)) return false;
        return position == other.position && length == other.length && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, position, length);
    }

    @Override
    public String toString() {
        return message + " @" + position + (length > 1 ? "+" + length : "");
    }
}
