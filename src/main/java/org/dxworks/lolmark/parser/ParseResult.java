package org.dxworks.lolmark.parser;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class ParseResult {

    private final int tokenCount;
    private final Map<String, Integer> constructCounts;
    private final List<ScopeAnalyzer.Declaration> declarations;

    public ParseResult(int tokenCount,
                       Map<String, Integer> constructCounts,
                       List<ScopeAnalyzer.Declaration> declarations) {
        this.tokenCount = tokenCount;
        this.constructCounts = Collections.unmodifiableMap(constructCounts);
        this.declarations = Collections.unmodifiableList(declarations);
    }

    public int getTokenCount() {
        return tokenCount;
    }

    // sorted by construct name
    public Map<String, Integer> getConstructCounts() {
        return constructCounts;
    }

    public List<ScopeAnalyzer.Declaration> getDeclarations() {
        return declarations;
    }
}
