package org.bacon.compiler.frontend.parser;

import org.bacon.compiler.frontend.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binding strengths of operators, from weakest to strongest. The declaration order
 * is significant: a higher ordinal binds tighter.
 */
public enum Precedence {
    LOWEST,
    /** {@code ==} and {@code !=} */
    EQUALS,
    /** {@code <} and {@code >} */
    LESS_GREATER,
    /** {@code +} and {@code -} */
    SUM,
    /** {@code *} and {@code /} */
    PRODUCT,
    /** unary {@code -x} and {@code !x} */
    PREFIX,
    /** {@code function(x)} */
    CALL;

    private static final Map<TokenType, Precedence> INFIX_PRECEDENCES = new EnumMap<>(TokenType.class);

    static {
        INFIX_PRECEDENCES.put(TokenType.EQUAL, EQUALS);
        INFIX_PRECEDENCES.put(TokenType.NOT_EQUAL, EQUALS);
        INFIX_PRECEDENCES.put(TokenType.LESS_THAN, LESS_GREATER);
        INFIX_PRECEDENCES.put(TokenType.GREATER_THAN, LESS_GREATER);
        INFIX_PRECEDENCES.put(TokenType.PLUS, SUM);
        INFIX_PRECEDENCES.put(TokenType.MINUS, SUM);
        INFIX_PRECEDENCES.put(TokenType.ASTERISK, PRODUCT);
        INFIX_PRECEDENCES.put(TokenType.SLASH, PRODUCT);
        INFIX_PRECEDENCES.put(TokenType.LEFT_PAREN, CALL);
    }

    /**
     * Looks up how strongly a token binds when it appears between two operands.
     *
     * @param type The token type.
     * @return The precedence, or {@link #LOWEST} for tokens that are not infix operators.
     */
    public static Precedence of(TokenType type) {
        return INFIX_PRECEDENCES.getOrDefault(type, LOWEST);
    }

    /**
     * @param other The precedence to compare with.
     * @return true if this precedence binds strictly tighter than {@code other}.
     */
    public boolean bindsTighterThan(Precedence other) {
        return compareTo(other) > 0;
    }
}
