package org.bacon.repl;

import java.util.Locale;

/**
 * What the REPL prints for each line of input.
 */
public enum ReplMode {
    /** Print every token of the line. */
    TOKENS,
    /** Print the program rendered back to source text, or the parser errors. */
    PARSE,
    /** Print the program as an indented node tree, or the parser errors. */
    TREE;

    /**
     * Resolves a mode name, ignoring case.
     *
     * @param name The mode name, e.g. {@code tokens}.
     * @return The mode.
     * @throws IllegalArgumentException if no mode has that name.
     */
    public static ReplMode fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
