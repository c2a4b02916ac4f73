package org.bacon.compiler.frontend.parser;

import org.bacon.compiler.diagnostics.DiagnosticsEngine;
import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.ast.BlockStatementNode;
import org.bacon.compiler.frontend.parser.ast.Expression;

/**
 * An interface that encapsulates the state of one parse session.
 * It provides parse handlers with access to the token window (current and peek token),
 * recursive parsing and error reporting without coupling them to the parser itself.
 */
public interface ParsingContext {

    /**
     * Returns the token currently being examined.
     * @return The current token.
     */
    Token currentToken();

    /**
     * Returns the lookahead token without consuming it.
     * @return The token after the current one.
     */
    Token peekToken();

    /**
     * Advances the window by one token: the peek token becomes the current token.
     */
    void nextToken();

    /**
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    boolean currentIs(TokenType type);

    /**
     * @param type The token type to check.
     * @return true if the peek token is of the given type.
     */
    boolean peekIs(TokenType type);

    /**
     * Advances if the peek token is of the expected type. Otherwise an error is reported
     * and the window stays where it is; the caller must abort the current construct.
     *
     * @param type The expected token type.
     * @return true if the token matched and was consumed.
     */
    boolean expectPeek(TokenType type);

    /**
     * @return The infix precedence of the current token.
     */
    Precedence currentPrecedence();

    /**
     * Parses an expression starting at the current token, binding operators that are
     * stronger than {@code precedence}.
     *
     * @param precedence The binding strength of the operator to the left of the expression.
     * @return The expression, or {@code null} if an error was reported.
     */
    Expression parseExpression(Precedence precedence);

    /**
     * Parses a block. The current token must be the opening brace; on return it is the closing one.
     * @return The block, or {@code null} if the block is not terminated.
     */
    BlockStatementNode parseBlockStatement();

    /**
     * Gets the diagnostics engine for reporting errors.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();
}
