package org.dxworks.lolmark.lexer;

public enum TokenCategory {
    DOCUMENT_START("'#hai'"),
    DOCUMENT_END("'#kthxbye'"),
    COMMENT_START("'#obtw'"),
    COMMENT_END("'#tldr'"),
    BLOCK_START("'#maek'"),
    BLOCK_END("'#oic'"),
    ELEMENT_START("'#gimmeh'"),
    ELEMENT_END("'#mkay'"),
    VARIABLE_DECLARE_START("'#i'"),
    VARIABLE_DECLARE_MID("'#it'"),
    VARIABLE_USE_START("'#lemme'"),

    HEAD("'head'"),
    TITLE("'title'"),
    PARAGRAPH("'paragraf'"),
    BOLD("'bold'"),
    ITALICS("'italics'"),
    LIST("'list'"),
    ITEM("'item'"),
    NEWLINE("'newline'"),
    SOUNDZ("'soundz'"),
    VIDZ("'vidz'"),

    FREE_TEXT("text"),
    ADDRESS("an address"),
    IDENTIFIER("an identifier");

    private final String description;

    TokenCategory(String description) {
        this.description = description;
    }

    // as named in error messages
    public String getDescription() {
        return description;
    }

    public boolean isTag() {
        return ordinal() <= VARIABLE_USE_START.ordinal();
    }
}
