package org.dxworks.lolmark.parser;

import org.dxworks.lolmark.error.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Static scope checking for variable declarations and uses.
 * <p>
 * Holds a stack of {@link ScopeFrame}s whose bottom is the global frame; the global frame is
 * never popped. Declarations only collide with names in the innermost frame, so an inner frame
 * may shadow an outer one. Lookups search from the innermost frame outwards.
 */
public class ScopeAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ScopeAnalyzer.class);

    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private final List<Declaration> declarations = new ArrayList<>();

    public ScopeAnalyzer() {
        frames.push(new ScopeFrame());
    }

    public void pushScope() {
        frames.push(new ScopeFrame());
        logger.debug("Entered scope at depth {}", getDepth());
    }

    public void popScope() {
        if (frames.size() == 1) {
            throw new IllegalStateException("The global scope cannot be popped");
        }
        frames.pop();
        logger.debug("Left scope, back at depth {}", getDepth());
    }

    /** Number of frames above the global one; 0 means global scope. */
    public int getDepth() {
        return frames.size() - 1;
    }

    public VariableBinding declare(String name, String value, int line) throws CompilationException {
        VariableBinding binding = new VariableBinding(name, value, line);
        VariableBinding existing = frames.peek().putIfAbsent(binding);
        if (existing != null) {
            throw CompilationException.semantic(line,
                    "variable '" + name + "' is already declared in this scope on line " + existing.getLine());
        }
        declarations.add(new Declaration(binding, getDepth()));
        logger.debug("Declared {} at depth {}", binding, getDepth());
        return binding;
    }

    public VariableBinding lookup(String name, int line) throws CompilationException {
        for (ScopeFrame frame : frames) {
            VariableBinding binding = frame.get(name);
            if (binding != null) {
                return binding;
            }
        }
        throw CompilationException.semantic(line,
                "variable '" + name + "' is not declared; declare it first with '#i haz "
                        + name + " #it iz <value> #mkay'");
    }

    /** Every successful declaration so far, in source order. */
    public List<Declaration> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public static final class Declaration {
        private final VariableBinding binding;
        private final int scopeDepth;

        Declaration(VariableBinding binding, int scopeDepth) {
            this.binding = binding;
            this.scopeDepth = scopeDepth;
        }

        public VariableBinding getBinding() {
            return binding;
        }

        public int getScopeDepth() {
            return scopeDepth;
        }
    }
}
