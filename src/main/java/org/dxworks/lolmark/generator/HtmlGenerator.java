package org.dxworks.lolmark.generator;

import org.dxworks.lolmark.lexer.Token;
import org.dxworks.lolmark.lexer.TokenQueue;
import org.dxworks.lolmark.lexer.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Emits HTML for a token sequence that already passed parsing and scope checking.
 * <p>
 * This is a second walk over its own copy of the tokens, matching tags against the
 * shared {@link Vocabulary} directly instead of going through the parser. Free text is
 * written with a single leading space per word.
 */
public class HtmlGenerator {

    private static final Logger logger = LoggerFactory.getLogger(HtmlGenerator.class);

    private final VariableResolution resolution;

    public HtmlGenerator() {
        this(VariableResolution.SCOPED);
    }

    public HtmlGenerator(VariableResolution resolution) {
        this.resolution = resolution;
    }

    /**
     * @throws IllegalStateException if the tokens are not a valid document
     */
    public String generate(List<Token> tokens) {
        String html = new Pass(new TokenQueue(tokens), resolution.createResolver()).run();
        logger.debug("Generated {} characters of HTML from {} tokens", html.length(), tokens.size());
        return html;
    }

    private enum OpenElement {
        HEAD("</head>", true),
        PARAGRAPH("</p>", true),
        LIST("</ul>", true),
        TITLE("</title>", false),
        BOLD("</b>", false),
        ITALICS("</i>", false),
        ITEM("</li>", false);

        private final String closingTag;
        private final boolean block;

        OpenElement(String closingTag, boolean block) {
            this.closingTag = closingTag;
            this.block = block;
        }
    }

    private static final class Pass {
        private final TokenQueue queue;
        private final VariableResolver variables;
        private final StringBuilder html = new StringBuilder();
        private final Deque<OpenElement> open = new ArrayDeque<>();

        Pass(TokenQueue queue, VariableResolver variables) {
            this.queue = queue;
            this.variables = variables;
        }

        String run() {
            Token token;
            while ((token = queue.poll()) != null) {
                switch (keyOf(token)) {
                    case Vocabulary.HAI -> html.append("<!DOCTYPE html><html>");
                    case Vocabulary.KTHXBYE -> html.append("</html>");
                    case Vocabulary.OBTW -> comment();
                    case Vocabulary.MAEK -> openBlock();
                    case Vocabulary.GIMMEH -> openElement();
                    case Vocabulary.OIC -> close(true, token);
                    case Vocabulary.MKAY -> close(false, token);
                    case Vocabulary.I -> declaration();
                    case Vocabulary.LEMME -> use();
                    default -> text(token);
                }
            }
            if (!open.isEmpty()) {
                throw new IllegalStateException("Unclosed " + open.peek() + " at end of document");
            }
            return html.toString();
        }

        private void comment() {
            html.append("<!--");
            Token token;
            while (!Vocabulary.TLDR.equals(keyOf(token = next("comment")))) {
                html.append(' ').append(token.getLexeme());
            }
            html.append(" -->");
        }

        private void openBlock() {
            Token keyword = next("#maek");
            switch (keyOf(keyword)) {
                case Vocabulary.HEAD -> push(OpenElement.HEAD, "<head>");
                case Vocabulary.PARAGRAF -> {
                    push(OpenElement.PARAGRAPH, "<p>");
                    variables.enterParagraph();
                }
                case Vocabulary.LIST -> push(OpenElement.LIST, "<ul>");
                default -> throw invalid(keyword);
            }
        }

        private void openElement() {
            Token keyword = next("#gimmeh");
            switch (keyOf(keyword)) {
                case Vocabulary.TITLE -> push(OpenElement.TITLE, "<title>");
                case Vocabulary.BOLD -> push(OpenElement.BOLD, "<b>");
                case Vocabulary.ITALICS -> push(OpenElement.ITALICS, "<i>");
                case Vocabulary.ITEM -> push(OpenElement.ITEM, "<li>");
                case Vocabulary.NEWLINE -> html.append("<br/>");
                case Vocabulary.SOUNDZ -> {
                    String address = media("soundz");
                    html.append("<audio controls><source src=\"").append(address)
                            .append("\" type=\"audio/mpeg\"></audio>");
                }
                case Vocabulary.VIDZ -> {
                    String address = media("vidz");
                    html.append("<iframe src=").append(address).append("></iframe>");
                }
                default -> throw invalid(keyword);
            }
        }

        private String media(String construct) {
            String address = next(construct).getLexeme();
            skip(Vocabulary.MKAY, construct);
            return address;
        }

        private void close(boolean block, Token closer) {
            OpenElement element = open.poll();
            if (element == null || element.block != block) {
                throw invalid(closer);
            }
            html.append(element.closingTag);
            if (element == OpenElement.PARAGRAPH) {
                variables.leaveParagraph();
            }
        }

        private void declaration() {
            skip(Vocabulary.HAZ, "variable declaration");
            String name = next("variable declaration").getLexeme();
            String value = null;

            Token peeked = queue.peek();
            if (peeked != null && Vocabulary.IT.equals(keyOf(peeked))) {
                queue.poll();
                skip(Vocabulary.IZ, "variable declaration");
                StringBuilder words = new StringBuilder();
                Token token;
                while (!Vocabulary.MKAY.equals(keyOf(token = next("variable declaration")))) {
                    if (words.length() > 0) {
                        words.append(' ');
                    }
                    words.append(token.getLexeme());
                }
                value = words.toString();
            }
            variables.declare(name, value);
        }

        private void use() {
            skip(Vocabulary.SEE, "variable use");
            String name = next("variable use").getLexeme();
            skip(Vocabulary.MKAY, "variable use");
            String value = variables.resolve(name);
            if (value != null) {
                html.append(' ').append(value);
            }
        }

        private void text(Token token) {
            if (token.getLexeme().charAt(0) == Vocabulary.TAG_PREFIX) {
                throw invalid(token);
            }
            html.append(' ').append(token.getLexeme());
        }

        private void push(OpenElement element, String openingTag) {
            open.push(element);
            html.append(openingTag);
        }

        private void skip(String expected, String construct) {
            Token token = next(construct);
            if (!expected.equals(keyOf(token))) {
                throw invalid(token);
            }
        }

        private Token next(String construct) {
            Token token = queue.poll();
            if (token == null) {
                throw new IllegalStateException("Document ends inside " + construct);
            }
            return token;
        }

        private static IllegalStateException invalid(Token token) {
            return new IllegalStateException("Unexpected token " + token + "; generate only validated documents");
        }

        private static String keyOf(Token token) {
            return token.getLexeme().toLowerCase(Locale.ROOT);
        }
    }
}
