package org.bacon.compiler.frontend.parser;

import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.features.conditional.IfExpressionParseHandler;
import org.bacon.compiler.frontend.parser.features.function.CallExpressionParseHandler;
import org.bacon.compiler.frontend.parser.features.function.FunctionLiteralParseHandler;
import org.bacon.compiler.frontend.parser.features.literal.BooleanLiteralParseHandler;
import org.bacon.compiler.frontend.parser.features.literal.IdentifierParseHandler;
import org.bacon.compiler.frontend.parser.features.literal.IntegerLiteralParseHandler;
import org.bacon.compiler.frontend.parser.features.operator.GroupedExpressionParseHandler;
import org.bacon.compiler.frontend.parser.features.operator.InfixOperatorParseHandler;
import org.bacon.compiler.frontend.parser.features.operator.PrefixOperatorParseHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for expression parse handlers. It maps each token type to the handler
 * used when that token begins an expression (prefix) and the handler used when it
 * appears between two operands (infix).
 */
public class ParseHandlerRegistry {
    private final Map<TokenType, IPrefixParseHandler> prefixHandlers = new EnumMap<>(TokenType.class);
    private final Map<TokenType, IInfixParseHandler> infixHandlers = new EnumMap<>(TokenType.class);

    /**
     * Registers the handler for expressions starting with the given token type.
     * @param type The token type.
     * @param handler The handler.
     */
    public void registerPrefix(TokenType type, IPrefixParseHandler handler) {
        prefixHandlers.put(type, handler);
    }

    /**
     * Registers the handler for the given token type in operator position.
     * @param type The token type.
     * @param handler The handler.
     */
    public void registerInfix(TokenType type, IInfixParseHandler handler) {
        infixHandlers.put(type, handler);
    }

    /**
     * Gets the prefix handler for a token type.
     * @param type The token type.
     * @return An {@link Optional} containing the handler if one is registered, otherwise empty.
     */
    public Optional<IPrefixParseHandler> getPrefix(TokenType type) {
        return Optional.ofNullable(prefixHandlers.get(type));
    }

    /**
     * Gets the infix handler for a token type.
     * @param type The token type.
     * @return An {@link Optional} containing the handler if one is registered, otherwise empty.
     */
    public Optional<IInfixParseHandler> getInfix(TokenType type) {
        return Optional.ofNullable(infixHandlers.get(type));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link ParseHandlerRegistry} with all handlers registered.
     */
    public static ParseHandlerRegistry initialize() {
        ParseHandlerRegistry registry = new ParseHandlerRegistry();

        registry.registerPrefix(TokenType.IDENTIFIER, new IdentifierParseHandler());
        registry.registerPrefix(TokenType.INTEGER, new IntegerLiteralParseHandler());
        BooleanLiteralParseHandler booleanHandler = new BooleanLiteralParseHandler();
        registry.registerPrefix(TokenType.TRUE, booleanHandler);
        registry.registerPrefix(TokenType.FALSE, booleanHandler);
        PrefixOperatorParseHandler prefixOperator = new PrefixOperatorParseHandler();
        registry.registerPrefix(TokenType.BANG, prefixOperator);
        registry.registerPrefix(TokenType.MINUS, prefixOperator);
        registry.registerPrefix(TokenType.LEFT_PAREN, new GroupedExpressionParseHandler());
        registry.registerPrefix(TokenType.IF, new IfExpressionParseHandler());
        registry.registerPrefix(TokenType.FUNCTION, new FunctionLiteralParseHandler());

        InfixOperatorParseHandler infixOperator = new InfixOperatorParseHandler();
        for (TokenType operator : new TokenType[]{
                TokenType.PLUS, TokenType.MINUS, TokenType.ASTERISK, TokenType.SLASH,
                TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS_THAN, TokenType.GREATER_THAN}) {
            registry.registerInfix(operator, infixOperator);
        }
        registry.registerInfix(TokenType.LEFT_PAREN, new CallExpressionParseHandler());

        return registry;
    }
}
