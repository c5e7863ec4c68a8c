package org.dxworks.lolmark.error;

public enum ErrorKind {
    LEXICAL("lexical", "Lexical"),
    SYNTAX("syntax", "Syntax"),
    SEMANTIC("semantic", "Semantic");

    private final String key;
    private final String label;

    ErrorKind(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }
}
