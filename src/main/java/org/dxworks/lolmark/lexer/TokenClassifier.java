package org.dxworks.lolmark.lexer;

import java.util.Locale;
import java.util.Optional;

/**
 * Maps a lexeme to its syntactic category. Keyword lookups ignore case.
 * <p>
 * Lexemes starting with {@link Vocabulary#TAG_PREFIX} are only checked against the tag
 * keywords. Anything else is checked against the element keywords and then against the
 * free-text, address and identifier patterns, in that order. A word may fit more than one
 * category (every identifier is also free text); the parser decides which reading applies
 * from context, using the {@code is*} predicates.
 */
public class TokenClassifier {

    public Optional<TokenCategory> classify(String lexeme) {
        if (lexeme.isEmpty()) {
            return Optional.empty();
        }
        String key = normalize(lexeme);
        if (lexeme.charAt(0) == Vocabulary.TAG_PREFIX) {
            return Optional.ofNullable(Vocabulary.TAG_KEYWORDS.get(key));
        }

        TokenCategory keyword = Vocabulary.ELEMENT_KEYWORDS.get(key);
        if (keyword != null) {
            return Optional.of(keyword);
        }
        if (isFreeText(lexeme)) {
            return Optional.of(TokenCategory.FREE_TEXT);
        }
        if (isAddress(lexeme)) {
            return Optional.of(TokenCategory.ADDRESS);
        }
        if (isIdentifier(lexeme)) {
            return Optional.of(TokenCategory.IDENTIFIER);
        }
        return Optional.empty();
    }

    public boolean isFreeText(String lexeme) {
        return Vocabulary.FREE_TEXT.matcher(lexeme).matches();
    }

    public boolean isAddress(String lexeme) {
        return Vocabulary.ADDRESS.matcher(lexeme).matches();
    }

    public boolean isIdentifier(String lexeme) {
        return Vocabulary.IDENTIFIER.matcher(lexeme).matches();
    }

    /** Case-insensitive comparison against a fixed keyword or marker word. */
    public boolean isWord(String lexeme, String word) {
        return normalize(lexeme).equals(word);
    }

    private static String normalize(String lexeme) {
        return lexeme.toLowerCase(Locale.ROOT);
    }
}
