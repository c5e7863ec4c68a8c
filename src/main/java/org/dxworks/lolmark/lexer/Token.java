package org.dxworks.lolmark.lexer;

import java.util.Objects;

public final class Token {

    private final String lexeme;
    private final int line;

    public Token(String lexeme, int line) {
        this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers start at 1, got " + line);
        }
        this.line = line;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token other)) {
            return false;
        }
        return line == other.line && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lexeme, line);
    }

    @Override
    public String toString() {
        return lexeme + "@" + line;
    }
}
