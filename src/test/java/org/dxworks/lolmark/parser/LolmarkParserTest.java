package org.dxworks.lolmark.parser;

import org.dxworks.lolmark.error.CompilationException;
import org.dxworks.lolmark.error.ErrorKind;
import org.dxworks.lolmark.lexer.Tokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LolmarkParserTest {

    private final Tokenizer tokenizer = new Tokenizer();
    private final LolmarkParser parser = new LolmarkParser();

    @ParameterizedTest
    @ValueSource(strings = {
            "#hai #kthxbye",
            "#hai #maek head #gimmeh title hi #mkay #oic #kthxbye",
            "#hai #maek head #gimmeh title #mkay #oic #kthxbye",
            "#hai #obtw note #tldr #i haz x #obtw another #tldr #maek head #gimmeh title t #mkay #oic #kthxbye",
            "#hai #maek paragraf my head and list are text #oic #kthxbye",
            "#hai #maek paragraf a #gimmeh newline b #gimmeh soundz a.mp3 #mkay #obtw c #tldr #oic #kthxbye",
            "#hai #maek list #oic #kthxbye",
            "#hai #maek list #gimmeh item a #gimmeh bold b #mkay #mkay #gimmeh item #mkay #oic #kthxbye",
            "#hai #gimmeh vidz https://v.com/a%20b #mkay #kthxbye",
            "#hai #i haz list #it iz x #mkay #lemme see list #mkay #kthxbye",
            "#hai #maek paragraf #maek list #gimmeh item x #mkay #oic #oic #kthxbye",
            "#HAI #MAEK PARAGRAF Loud #OIC #KTHXBYE"
    })
    void parse_ValidDocuments(String source) {
        assertDoesNotThrow(() -> parse(source));
    }

    @Test
    void parse_CountsConstructs() throws CompilationException {
        ParseResult result = parse("#hai #maek head #gimmeh title hi #mkay #oic "
                + "#maek paragraf #gimmeh bold a #mkay #gimmeh bold b #mkay #oic #kthxbye");

        assertEquals(20, result.getTokenCount());
        assertEquals(Map.of("bold", 2, "document", 1, "head", 1, "paragraph", 1, "title", 1),
                result.getConstructCounts());
    }

    @Test
    void parse_MissingDocumentStart() {
        CompilationException e = expectError("#maek paragraf hi #oic #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected '#hai' in document, found '#maek'", e.getDetail());
        assertEquals(1, e.getLine());
    }

    @Test
    void parse_EmptyInput() {
        CompilationException e = expectError("   \n", ErrorKind.SYNTAX);

        assertEquals("unexpected end of input in document, expected '#hai'", e.getDetail());
    }

    @Test
    void parse_MissingDocumentEnd() {
        CompilationException e = expectError("#hai\n#maek paragraf hi #oic", ErrorKind.SYNTAX);

        assertEquals("unexpected end of input in document body, expected '#kthxbye'", e.getDetail());
        assertEquals(2, e.getLine());
    }

    @Test
    void parse_TokensAfterDocument() {
        CompilationException e = expectError("#hai #kthxbye\nmore", ErrorKind.SYNTAX);

        assertEquals("additional tokens after document: 'more'", e.getDetail());
        assertEquals(2, e.getLine());
    }

    @Test
    void parse_UnrecognizedLexeme() {
        CompilationException e = expectError("#hai\nhello @world\n#kthxbye", ErrorKind.LEXICAL);

        assertEquals("'@world' is not a recognized token", e.getDetail());
        assertEquals(2, e.getLine());
        assertEquals("Lexical error on line 2: '@world' is not a recognized token", e.getMessage());
    }

    @Test
    void parse_UnknownTagIsLexicalError() {
        expectError("#hai #nope #kthxbye", ErrorKind.LEXICAL);
    }

    @Test
    void parse_CommentContentIsStillLexicallyChecked() {
        expectError("#hai #obtw <b> #tldr #kthxbye", ErrorKind.LEXICAL);
    }

    @Test
    void parse_UnterminatedComment() {
        CompilationException e = expectError("#hai #obtw blah", ErrorKind.SYNTAX);

        assertEquals("unexpected end of input in comment, expected '#tldr'", e.getDetail());
    }

    @Test
    void parse_DuplicateDeclarationInParagraph() {
        CompilationException e = expectError("#hai\n#maek paragraf\n#i haz x #it iz a #mkay\n"
                + "#i haz x #it iz b #mkay\n#oic\n#kthxbye", ErrorKind.SEMANTIC);

        assertEquals(4, e.getLine());
        assertEquals("variable 'x' is already declared in this scope on line 3", e.getDetail());
    }

    @Test
    void parse_DuplicateDeclarationInGlobalScope() {
        expectError("#hai #i haz x #i haz x #kthxbye", ErrorKind.SEMANTIC);
    }

    @Test
    void parse_RedeclareInOuterScopeAfterParagraphCloses() {
        assertDoesNotThrow(() -> parse("#hai #maek paragraf #i haz x #it iz a #mkay #oic "
                + "#i haz x #it iz b #mkay #kthxbye"));
    }

    @Test
    void parse_ShadowOuterDeclarationInParagraph() {
        assertDoesNotThrow(() -> parse("#hai #i haz x #it iz a #mkay "
                + "#maek paragraf #i haz x #it iz b #mkay #lemme see x #mkay #oic #kthxbye"));
    }

    @Test
    void parse_UseOfOuterDeclaration() {
        assertDoesNotThrow(() -> parse("#hai #i haz x #it iz hello #mkay "
                + "#maek paragraf #gimmeh bold #lemme see x #mkay #mkay #oic #kthxbye"));
    }

    @Test
    void parse_UndeclaredUse() {
        CompilationException e = expectError("#hai #maek paragraf #lemme see x #mkay #oic #kthxbye",
                ErrorKind.SEMANTIC);

        assertTrue(e.getDetail().startsWith("variable 'x' is not declared"), e.getDetail());
    }

    @Test
    void parse_UseAfterDeclaringScopeClosed() {
        expectError("#hai #maek paragraf #i haz x #oic #lemme see x #mkay #kthxbye", ErrorKind.SEMANTIC);
    }

    @Test
    void parse_UseBeforeDeclaration() {
        expectError("#hai #lemme see x #mkay #i haz x #kthxbye", ErrorKind.SEMANTIC);
    }

    @Test
    void parse_WrongElementAfterGimmeh() {
        CompilationException e = expectError("#hai #gimmeh item x #mkay #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected 'bold', 'italics', 'newline', 'soundz', 'vidz' after '#gimmeh' "
                + "in document body, found 'item'", e.getDetail());
    }

    @Test
    void parse_MediaNeedsAddress() {
        CompilationException e = expectError("#hai #gimmeh soundz #mkay #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected an address in soundz, found '#mkay'", e.getDetail());
    }

    @Test
    void parse_HeadOnlyAtDocumentStart() {
        expectError("#hai #maek paragraf x #oic #maek head #gimmeh title t #mkay #oic #kthxbye",
                ErrorKind.SYNTAX);
    }

    @Test
    void parse_ListAcceptsOnlyItems() {
        CompilationException e = expectError("#hai #maek list hello #oic #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected '#gimmeh item' or '#oic' in list, found 'hello'", e.getDetail());
    }

    @Test
    void parse_ParagraphsDoNotNest() {
        expectError("#hai #maek paragraf #maek paragraf x #oic #oic #kthxbye", ErrorKind.SYNTAX);
    }

    @Test
    void parse_DeclarationNeedsHaz() {
        CompilationException e = expectError("#hai #i has x #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected 'haz' in variable declaration, found 'has'", e.getDetail());
    }

    @Test
    void parse_IdentifierIsLettersOnly() {
        CompilationException e = expectError("#hai #i haz x1 #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected an identifier in variable declaration, found 'x1'", e.getDetail());
    }

    @Test
    void parse_DeclarationValueMustNotBeEmpty() {
        CompilationException e = expectError("#hai #i haz x #it iz #mkay #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected a value after '#it iz' in variable declaration, found '#mkay'", e.getDetail());
    }

    @Test
    void parse_VariableUseNeedsClosingMkay() {
        CompilationException e = expectError("#hai #i haz x #lemme see x #kthxbye", ErrorKind.SYNTAX);

        assertEquals("expected '#mkay' in variable use, found '#kthxbye'", e.getDetail());
    }

    @Test
    void parse_UnclosedBold() {
        CompilationException e = expectError("#hai #gimmeh bold loud", ErrorKind.SYNTAX);

        assertEquals("unexpected end of input in bold, expected '#mkay'", e.getDetail());
    }

    private ParseResult parse(String source) throws CompilationException {
        return parser.parse(tokenizer.tokenize(source));
    }

    private CompilationException expectError(String source, ErrorKind kind) {
        CompilationException e = assertThrows(CompilationException.class, () -> parse(source));
        assertEquals(kind, e.getKind(), e.getMessage());
        return e;
    }
}
