package org.dxworks.lolmark.model;

public class ErrorInfo {
    public String kind; // lexical, syntax, semantic
    public int line;
    public String message;
}
