package org.bacon.compiler.frontend.lexer;

import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Each type carries the name under which it appears in diagnostics.
 */
public enum TokenType {
    // Special tokens.
    /** Represents an unexpected or unknown character. */
    ILLEGAL("ILLEGAL"),
    /** Represents the end of the source text. */
    END_OF_FILE("EOF"),

    // Identifiers & literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER("IDENT"),
    /** An integer literal, kept as text until the parser converts it. */
    INTEGER("INT"),

    // Operators.
    /** The '=' character, used for bindings. */
    ASSIGN("="),
    PLUS("+"),
    MINUS("-"),
    BANG("!"),
    ASTERISK("*"),
    SLASH("/"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    EQUAL("=="),
    NOT_EQUAL("!="),

    // Delimiters.
    COMMA(","),
    SEMICOLON(";"),
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),

    // Keywords.
    /** The 'fn' keyword, introducing a function literal. */
    FUNCTION("FUNCTION"),
    LET("LET"),
    TRUE("TRUE"),
    FALSE("FALSE"),
    IF("IF"),
    ELSE("ELSE"),
    RETURN("RETURN");

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "fn", FUNCTION,
            "let", LET,
            "true", TRUE,
            "false", FALSE,
            "if", IF,
            "else", ELSE,
            "return", RETURN
    );

    private final String displayName;

    TokenType(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Gets the name used for this type in error messages.
     * @return The display name, e.g. {@code IDENT} or {@code ==}.
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves the type of a scanned word. Keywords are matched exactly and case-sensitively;
     * everything else is an identifier.
     *
     * @param text The identifier text.
     * @return The keyword type, or {@link #IDENTIFIER}.
     */
    public static TokenType lookupIdentifier(String text) {
        return KEYWORDS.getOrDefault(text, IDENTIFIER);
    }
}
