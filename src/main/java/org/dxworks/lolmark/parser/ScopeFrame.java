package org.dxworks.lolmark.parser;

import java.util.LinkedHashMap;
import java.util.Map;

public class ScopeFrame {

    private final Map<String, VariableBinding> bindings = new LinkedHashMap<>();

    public VariableBinding get(String name) {
        return bindings.get(name);
    }

    // returns the binding already under that name, null if this one was added
    public VariableBinding putIfAbsent(VariableBinding binding) {
        return bindings.putIfAbsent(binding.getName(), binding);
    }
}
