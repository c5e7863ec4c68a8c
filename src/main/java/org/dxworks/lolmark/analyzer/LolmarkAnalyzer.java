package org.dxworks.lolmark.analyzer;

import org.dxworks.lolmark.error.CompilationException;
import org.dxworks.lolmark.lexer.Token;
import org.dxworks.lolmark.lexer.Tokenizer;
import org.dxworks.lolmark.model.DocumentAnalysis;
import org.dxworks.lolmark.model.ErrorInfo;
import org.dxworks.lolmark.model.VariableInfo;
import org.dxworks.lolmark.parser.LolmarkParser;
import org.dxworks.lolmark.parser.ParseResult;
import org.dxworks.lolmark.parser.ScopeAnalyzer;

import java.util.List;

/**
 * Builds a {@link DocumentAnalysis} for a source file. Compilation errors are recorded in the
 * analysis instead of being thrown.
 */
public class LolmarkAnalyzer {

    private final Tokenizer tokenizer;
    private final LolmarkParser parser;

    public LolmarkAnalyzer() {
        this(new Tokenizer(), new LolmarkParser());
    }

    public LolmarkAnalyzer(Tokenizer tokenizer, LolmarkParser parser) {
        this.tokenizer = tokenizer;
        this.parser = parser;
    }

    public DocumentAnalysis analyze(String filePath, String sourceCode) {
        DocumentAnalysis analysis = new DocumentAnalysis();
        analysis.filePath = filePath;

        List<Token> tokens = tokenizer.tokenize(sourceCode);
        analysis.tokens = tokens.size();

        try {
            ParseResult result = parser.parse(tokens);
            analysis.valid = true;
            analysis.constructs.putAll(result.getConstructCounts());
            for (ScopeAnalyzer.Declaration declaration : result.getDeclarations()) {
                analysis.variables.add(createVariableInfo(declaration));
            }
        } catch (CompilationException e) {
            analysis.valid = false;
            analysis.error = createErrorInfo(e);
        }

        return analysis;
    }

    private VariableInfo createVariableInfo(ScopeAnalyzer.Declaration declaration) {
        VariableInfo info = new VariableInfo();
        info.name = declaration.getBinding().getName();
        info.value = declaration.getBinding().getValue();
        info.line = declaration.getBinding().getLine();
        info.scopeDepth = declaration.getScopeDepth();
        return info;
    }

    private ErrorInfo createErrorInfo(CompilationException e) {
        ErrorInfo info = new ErrorInfo();
        info.kind = e.getKind().getKey();
        info.line = e.getLine();
        info.message = e.getDetail();
        return info;
    }
}
