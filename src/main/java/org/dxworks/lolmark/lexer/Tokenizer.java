package org.dxworks.lolmark.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits source text on whitespace. Lexemes are never merged or split by content;
 * classification happens later, when a pass consumes the tokens.
 */
public class Tokenizer {

    private static final Logger logger = LoggerFactory.getLogger(Tokenizer.class);

    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int line = 1;

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (isBoundary(c)) {
                flush(current, line, tokens);
                if (c == '\n') {
                    line++;
                }
            } else {
                current.append(c);
            }
        }
        flush(current, line, tokens);

        logger.debug("Tokenized {} lines into {} tokens", line, tokens.size());
        return Collections.unmodifiableList(tokens);
    }

    // Unicode White_Space, including the no-break spaces and NEL
    private static boolean isBoundary(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    private void flush(StringBuilder current, int line, List<Token> tokens) {
        if (current.length() > 0) {
            tokens.add(new Token(current.toString(), line));
            current.setLength(0);
        }
    }
}
