package org.dxworks.lolmark.generator;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

public class ScopedVariableResolver implements VariableResolver {

    private final Deque<Map<String, String>> frames = new ArrayDeque<>();

    public ScopedVariableResolver() {
        frames.push(new HashMap<>());
    }

    @Override
    public void declare(String name, String value) {
        frames.peek().put(name, value);
    }

    @Override
    public String resolve(String name) {
        for (Map<String, String> frame : frames) {
            if (frame.containsKey(name)) {
                return frame.get(name);
            }
        }
        return null;
    }

    @Override
    public void enterParagraph() {
        frames.push(new HashMap<>());
    }

    @Override
    public void leaveParagraph() {
        if (frames.size() > 1) {
            frames.pop();
        }
    }
}
