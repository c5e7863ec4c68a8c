package org.dxworks.lolmark.generator;

/**
 * How the generator maps a variable use to the value it prints.
 */
public enum VariableResolution {
    /** Name lookup through paragraph scopes; prints the value the analyzer resolved. */
    SCOPED {
        @Override
        public VariableResolver createResolver() {
            return new ScopedVariableResolver();
        }
    },
    /** Every use prints the most recently declared value. Kept for output compatibility. */
    LAST_DECLARED {
        @Override
        public VariableResolver createResolver() {
            return new LastDeclaredVariableResolver();
        }
    };

    public abstract VariableResolver createResolver();
}
