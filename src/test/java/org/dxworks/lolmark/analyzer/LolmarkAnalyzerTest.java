package org.dxworks.lolmark.analyzer;

import org.dxworks.lolmark.model.DocumentAnalysis;
import org.dxworks.lolmark.model.VariableInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LolmarkAnalyzerTest {

    private final LolmarkAnalyzer analyzer = new LolmarkAnalyzer();

    @Test
    void analyze_RecordsLexicalErrorInsteadOfThrowing() {
        DocumentAnalysis analysis = analyzer.analyze("bad.lol", "#hai\n#maek paragraf <p> #oic\n#kthxbye");

        assertFalse(analysis.valid);
        assertEquals(6, analysis.tokens);
        assertEquals("lexical", analysis.error.kind);
        assertEquals(2, analysis.error.line);
        assertEquals("'<p>' is not a recognized token", analysis.error.message);
        assertTrue(analysis.constructs.isEmpty());
    }

    @Test
    void analyze_RecordsDeclarationDepths() {
        DocumentAnalysis analysis = analyzer.analyze("ok.lol", "#hai #i haz who #it iz world #mkay\n"
                + "#maek paragraf #i haz who hi #lemme see who #mkay #oic #kthxbye");

        assertTrue(analysis.valid);
        assertNull(analysis.error);
        assertEquals(2, analysis.variables.size());

        VariableInfo global = analysis.variables.get(0);
        assertEquals("who", global.name);
        assertEquals("world", global.value);
        assertEquals(0, global.scopeDepth);

        VariableInfo inner = analysis.variables.get(1);
        assertEquals(2, inner.line);
        assertNull(inner.value);
        assertEquals(1, inner.scopeDepth);
    }
}
