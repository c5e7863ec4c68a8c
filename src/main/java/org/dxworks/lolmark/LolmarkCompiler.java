package org.dxworks.lolmark;

import org.dxworks.lolmark.error.CompilationException;
import org.dxworks.lolmark.generator.HtmlGenerator;
import org.dxworks.lolmark.generator.VariableResolution;
import org.dxworks.lolmark.lexer.Token;
import org.dxworks.lolmark.lexer.Tokenizer;
import org.dxworks.lolmark.parser.LolmarkParser;
import org.dxworks.lolmark.parser.ParseResult;

import java.util.List;

/**
 * Tokenize, check, then generate. Generation only starts once the whole document has
 * been checked, and parser and generator each consume their own copy of the tokens.
 */
public class LolmarkCompiler {

    private final Tokenizer tokenizer;
    private final LolmarkParser parser;
    private final HtmlGenerator generator;

    public LolmarkCompiler() {
        this(VariableResolution.SCOPED);
    }

    public LolmarkCompiler(VariableResolution resolution) {
        this(new Tokenizer(), new LolmarkParser(), new HtmlGenerator(resolution));
    }

    public LolmarkCompiler(Tokenizer tokenizer, LolmarkParser parser, HtmlGenerator generator) {
        this.tokenizer = tokenizer;
        this.parser = parser;
        this.generator = generator;
    }

    public static LolmarkCompiler from(LolmarkConfig config) {
        return new LolmarkCompiler(config.getVariableResolution());
    }

    public List<Token> tokenize(String source) {
        return tokenizer.tokenize(source);
    }

    /** Validates the document without generating anything. */
    public ParseResult check(String source) throws CompilationException {
        return parser.parse(tokenize(source));
    }

    public String compile(String source) throws CompilationException {
        List<Token> tokens = tokenize(source);
        parser.parse(tokens);
        return generator.generate(tokens);
    }
}
