package org.dxworks.lolmark.lexer;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;

public class TokenQueue {

    private final Deque<Token> tokens;
    private int lastLine = 1;

    public TokenQueue(Collection<Token> tokens) {
        this.tokens = new ArrayDeque<>(tokens);
    }

    public Token peek() {
        return tokens.peekFirst();
    }

    public Token poll() {
        Token token = tokens.pollFirst();
        if (token != null) {
            lastLine = token.getLine();
        }
        return token;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    // 1 until the first token is consumed
    public int getLastLine() {
        return lastLine;
    }
}
