package org.dxworks.lolmark.parser;

import org.dxworks.lolmark.error.CompilationException;
import org.dxworks.lolmark.lexer.Token;
import org.dxworks.lolmark.lexer.TokenCategory;
import org.dxworks.lolmark.lexer.TokenClassifier;
import org.dxworks.lolmark.lexer.TokenQueue;
import org.dxworks.lolmark.lexer.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser with one token of lookahead. Scope checking is interleaved with
 * parsing: declarations and uses are checked against a {@link ScopeAnalyzer} as they are
 * reached, and every paragraph gets its own scope frame.
 * <p>
 * Grammar:
 * <pre>
 * document      := #hai ( comment | var-decl )* head? body #kthxbye
 * head          := #maek head #gimmeh title text* #mkay #oic
 * body          := ( paragraph | list | styled-inline | media | newline
 *                  | comment | var-decl | var-use | text )*
 * paragraph     := #maek paragraf ( list | styled-inline | media | newline
 *                  | comment | var-decl | var-use | text )* #oic
 * list          := #maek list ( #gimmeh item ( styled-inline | var-use | text )* #mkay )* #oic
 * styled-inline := #gimmeh ( bold | italics ) ( var-use | text )* #mkay
 * media         := #gimmeh ( soundz | vidz ) address #mkay
 * newline       := #gimmeh newline
 * comment       := #obtw any* #tldr
 * var-decl      := #i haz identifier ( #it iz text+ #mkay )?
 * var-use       := #lemme see identifier #mkay
 * </pre>
 * Lexemes are classified as they become the lookahead, so a lexical error surfaces at the
 * position where the bad lexeme would have been read.
 */
public class LolmarkParser {

    private static final Logger logger = LoggerFactory.getLogger(LolmarkParser.class);

    private static final Set<TokenCategory> BODY_ELEMENTS = EnumSet.of(
            TokenCategory.BOLD, TokenCategory.ITALICS, TokenCategory.NEWLINE,
            TokenCategory.SOUNDZ, TokenCategory.VIDZ);
    private static final Set<TokenCategory> ITEM_ELEMENTS = EnumSet.of(
            TokenCategory.BOLD, TokenCategory.ITALICS);

    private final TokenClassifier classifier;

    public LolmarkParser() {
        this(new TokenClassifier());
    }

    public LolmarkParser(TokenClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Checks that the tokens form a valid document.
     *
     * @throws CompilationException on the first lexical, syntax or semantic error
     */
    public ParseResult parse(List<Token> tokens) throws CompilationException {
        ParseResult result = new Pass(new TokenQueue(tokens), new ScopeAnalyzer()).run(tokens.size());
        logger.debug("Parsed {} tokens: {}", result.getTokenCount(), result.getConstructCounts());
        return result;
    }

    /**
     * State of one parse: the token cursor, the lookahead and the scope stack.
     */
    private final class Pass {
        private final TokenQueue queue;
        private final ScopeAnalyzer scopes;
        private final Map<String, Integer> constructCounts = new TreeMap<>();

        private Token current;
        private TokenCategory category;

        Pass(TokenQueue queue, ScopeAnalyzer scopes) {
            this.queue = queue;
            this.scopes = scopes;
        }

        ParseResult run(int tokenCount) throws CompilationException {
            advance();
            parseDocument();
            return new ParseResult(tokenCount, constructCounts, scopes.getDeclarations());
        }

        private void parseDocument() throws CompilationException {
            expect(TokenCategory.DOCUMENT_START, "document");

            while (true) {
                if (is(TokenCategory.COMMENT_START)) {
                    parseComment();
                } else if (is(TokenCategory.VARIABLE_DECLARE_START)) {
                    parseVariableDeclaration();
                } else {
                    break;
                }
            }

            if (is(TokenCategory.BLOCK_START)) {
                advance();
                requireNotEnd("document body", "'head', 'paragraf' or 'list'");
                if (is(TokenCategory.HEAD)) {
                    parseHead();
                } else {
                    parseBlock("document body");
                }
            }

            parseBody();

            // #kthxbye stays the lookahead; nothing may follow it
            if (!queue.isEmpty()) {
                Token extra = queue.peek();
                throw CompilationException.syntax(extra.getLine(),
                        "additional tokens after document: '" + extra.getLexeme() + "'");
            }
            count("document");
        }

        private void parseHead() throws CompilationException {
            advance();
            expect(TokenCategory.ELEMENT_START, "head");
            require(TokenCategory.TITLE, "head");
            advance();
            while (!is(TokenCategory.ELEMENT_END)) {
                requireNotEnd("title", TokenCategory.ELEMENT_END.getDescription());
                parseText("title");
            }
            advance();
            count("title");
            expect(TokenCategory.BLOCK_END, "head");
            count("head");
        }

        private void parseBody() throws CompilationException {
            while (!is(TokenCategory.DOCUMENT_END)) {
                requireNotEnd("document body", TokenCategory.DOCUMENT_END.getDescription());
                switch (category) {
                    case BLOCK_START -> {
                        advance();
                        parseBlock("document body");
                    }
                    case ELEMENT_START -> {
                        advance();
                        parseElement("document body", BODY_ELEMENTS);
                    }
                    case COMMENT_START -> parseComment();
                    case VARIABLE_DECLARE_START -> parseVariableDeclaration();
                    case VARIABLE_USE_START -> parseVariableUse();
                    default -> parseText("document body");
                }
            }
        }

        /** Dispatches on the keyword following #maek. */
        private void parseBlock(String construct) throws CompilationException {
            requireNotEnd(construct, "'paragraf' or 'list'");
            if (is(TokenCategory.PARAGRAPH)) {
                parseParagraph();
            } else if (is(TokenCategory.LIST)) {
                parseList();
            } else {
                throw unexpected("'paragraf' or 'list' after '#maek'", construct);
            }
        }

        /** Dispatches on the keyword following #gimmeh. */
        private void parseElement(String construct, Set<TokenCategory> allowed) throws CompilationException {
            String expected = describe(allowed) + " after '#gimmeh'";
            requireNotEnd(construct, expected);
            if (!allowed.contains(category)) {
                throw unexpected(expected, construct);
            }
            switch (category) {
                case BOLD, ITALICS -> parseStyledInline();
                case SOUNDZ, VIDZ -> parseMedia();
                case NEWLINE -> parseNewline();
                default -> throw new IllegalStateException("No rule for element " + category);
            }
        }

        private void parseParagraph() throws CompilationException {
            advance();
            scopes.pushScope();
            while (!is(TokenCategory.BLOCK_END)) {
                requireNotEnd("paragraph", TokenCategory.BLOCK_END.getDescription());
                switch (category) {
                    case BLOCK_START -> {
                        advance();
                        requireNotEnd("paragraph", "'list'");
                        if (!is(TokenCategory.LIST)) {
                            throw unexpected("'list' after '#maek'", "paragraph");
                        }
                        parseList();
                    }
                    case ELEMENT_START -> {
                        advance();
                        parseElement("paragraph", BODY_ELEMENTS);
                    }
                    case COMMENT_START -> parseComment();
                    case VARIABLE_DECLARE_START -> parseVariableDeclaration();
                    case VARIABLE_USE_START -> parseVariableUse();
                    default -> parseText("paragraph");
                }
            }
            advance();
            scopes.popScope();
            count("paragraph");
        }

        private void parseList() throws CompilationException {
            advance();
            while (!is(TokenCategory.BLOCK_END)) {
                requireNotEnd("list", "'#gimmeh item' or '#oic'");
                if (!is(TokenCategory.ELEMENT_START)) {
                    throw unexpected("'#gimmeh item' or '#oic'", "list");
                }
                advance();
                requireNotEnd("list", "'item'");
                if (!is(TokenCategory.ITEM)) {
                    throw unexpected("'item' after '#gimmeh'", "list");
                }
                parseItem();
            }
            advance();
            count("list");
        }

        private void parseItem() throws CompilationException {
            advance();
            while (!is(TokenCategory.ELEMENT_END)) {
                requireNotEnd("list item", TokenCategory.ELEMENT_END.getDescription());
                if (is(TokenCategory.ELEMENT_START)) {
                    advance();
                    parseElement("list item", ITEM_ELEMENTS);
                } else if (is(TokenCategory.VARIABLE_USE_START)) {
                    parseVariableUse();
                } else {
                    parseText("list item");
                }
            }
            advance();
            count("item");
        }

        private void parseStyledInline() throws CompilationException {
            String construct = is(TokenCategory.BOLD) ? Vocabulary.BOLD : Vocabulary.ITALICS;
            advance();
            while (!is(TokenCategory.ELEMENT_END)) {
                requireNotEnd(construct, TokenCategory.ELEMENT_END.getDescription());
                if (is(TokenCategory.VARIABLE_USE_START)) {
                    parseVariableUse();
                } else {
                    parseText(construct);
                }
            }
            advance();
            count(construct);
        }

        private void parseMedia() throws CompilationException {
            String construct = is(TokenCategory.SOUNDZ) ? Vocabulary.SOUNDZ : Vocabulary.VIDZ;
            advance();
            requireNotEnd(construct, TokenCategory.ADDRESS.getDescription());
            if (category.isTag() || !classifier.isAddress(current.getLexeme())) {
                throw unexpected(TokenCategory.ADDRESS.getDescription(), construct);
            }
            advance();
            expect(TokenCategory.ELEMENT_END, construct);
            count(construct);
        }

        private void parseNewline() throws CompilationException {
            advance();
            count(Vocabulary.NEWLINE);
        }

        private void parseComment() throws CompilationException {
            advance();
            while (!is(TokenCategory.COMMENT_END)) {
                requireNotEnd("comment", TokenCategory.COMMENT_END.getDescription());
                advance();
            }
            advance();
            count("comment");
        }

        private void parseVariableDeclaration() throws CompilationException {
            advance();
            requireWord(Vocabulary.HAZ, "variable declaration");
            advance();
            Token name = requireIdentifier("variable declaration");
            advance();

            String value = null;
            if (is(TokenCategory.VARIABLE_DECLARE_MID)) {
                advance();
                requireWord(Vocabulary.IZ, "variable declaration");
                advance();
                value = parseValue();
            }

            scopes.declare(name.getLexeme(), value, name.getLine());
            count("variable declaration");
        }

        private String parseValue() throws CompilationException {
            StringBuilder value = new StringBuilder();
            while (!is(TokenCategory.ELEMENT_END)) {
                requireNotEnd("variable declaration", TokenCategory.ELEMENT_END.getDescription());
                String word = current.getLexeme();
                parseText("variable declaration");
                if (value.length() > 0) {
                    value.append(' ');
                }
                value.append(word);
            }
            if (value.length() == 0) {
                throw unexpected("a value after '#it iz'", "variable declaration");
            }
            advance();
            return value.toString();
        }

        private void parseVariableUse() throws CompilationException {
            advance();
            requireWord(Vocabulary.SEE, "variable use");
            advance();
            Token name = requireIdentifier("variable use");
            scopes.lookup(name.getLexeme(), name.getLine());
            advance();
            expect(TokenCategory.ELEMENT_END, "variable use");
            count("variable use");
        }

        private void parseText(String construct) throws CompilationException {
            if (category.isTag() || !classifier.isFreeText(current.getLexeme())) {
                throw unexpected(TokenCategory.FREE_TEXT.getDescription(), construct);
            }
            advance();
        }

        private void requireWord(String word, String construct) throws CompilationException {
            requireNotEnd(construct, "'" + word + "'");
            if (category.isTag() || !classifier.isWord(current.getLexeme(), word)) {
                throw unexpected("'" + word + "'", construct);
            }
        }

        private Token requireIdentifier(String construct) throws CompilationException {
            requireNotEnd(construct, TokenCategory.IDENTIFIER.getDescription());
            if (category.isTag() || !classifier.isIdentifier(current.getLexeme())) {
                throw unexpected(TokenCategory.IDENTIFIER.getDescription(), construct);
            }
            return current;
        }

        private void expect(TokenCategory expected, String construct) throws CompilationException {
            require(expected, construct);
            advance();
        }

        private void require(TokenCategory expected, String construct) throws CompilationException {
            requireNotEnd(construct, expected.getDescription());
            if (category != expected) {
                throw unexpected(expected.getDescription(), construct);
            }
        }

        private void requireNotEnd(String construct, String expected) throws CompilationException {
            if (current == null) {
                throw CompilationException.syntax(queue.getLastLine(),
                        "unexpected end of input in " + construct + ", expected " + expected);
            }
        }

        private CompilationException unexpected(String expected, String construct) {
            return CompilationException.syntax(current.getLine(),
                    "expected " + expected + " in " + construct + ", found '" + current.getLexeme() + "'");
        }

        private void advance() throws CompilationException {
            current = queue.poll();
            if (current == null) {
                category = null;
                return;
            }
            Token token = current;
            category = classifier.classify(token.getLexeme())
                    .orElseThrow(() -> CompilationException.lexical(token.getLine(), token.getLexeme()));
        }

        private boolean is(TokenCategory expected) {
            return current != null && category == expected;
        }

        private void count(String construct) {
            constructCounts.merge(construct, 1, Integer::sum);
        }
    }

    private static String describe(Set<TokenCategory> categories) {
        return categories.stream()
                .map(TokenCategory::getDescription)
                .collect(Collectors.joining(", "));
    }
}
