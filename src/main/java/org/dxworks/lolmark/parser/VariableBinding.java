package org.dxworks.lolmark.parser;

import java.util.Objects;

public final class VariableBinding {

    private final String name;
    private final String value; // null when declared without one
    private final int line;

    public VariableBinding(String name, String value, int line) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return name + (value != null ? "=" + value : "") + " (line " + line + ")";
    }
}
