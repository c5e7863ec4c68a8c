package org.dxworks.lolmark.generator;

/**
 * Variable bookkeeping used while generating HTML. Kept separate from the analyzer's
 * scope stack; generation only runs on documents that already passed scope checking.
 */
public interface VariableResolver {

    void declare(String name, String value);

    /** Value to print for a use of {@code name}; null prints nothing. */
    String resolve(String name);

    void enterParagraph();

    void leaveParagraph();
}
