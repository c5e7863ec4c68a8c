package org.dxworks.lolmark.model;

public class VariableInfo {
    public String name;
    public String value; // nullable, declared without a value
    public int line;
    public int scopeDepth; // 0 for the global scope
}
