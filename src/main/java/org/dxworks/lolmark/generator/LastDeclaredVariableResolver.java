package org.dxworks.lolmark.generator;

import java.util.ArrayList;
import java.util.List;

// Every use prints the newest value, whatever name was asked for.
public class LastDeclaredVariableResolver implements VariableResolver {

    private final List<String> values = new ArrayList<>();

    @Override
    public void declare(String name, String value) {
        values.add(value);
    }

    @Override
    public String resolve(String name) {
        return values.isEmpty() ? null : values.get(values.size() - 1);
    }

    @Override
    public void enterParagraph() {
        // paragraphs do not open a frame here
    }

    @Override
    public void leaveParagraph() {
        if (values.size() > 1) {
            values.remove(values.size() - 1);
        }
    }
}
