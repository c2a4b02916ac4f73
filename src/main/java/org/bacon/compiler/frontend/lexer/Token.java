package org.bacon.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., identifier, integer, an operator).
 * @param text The exact text of the token from the source code. Empty for {@link TokenType#END_OF_FILE}.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {
}
