package org.bacon.compiler.frontend.parser.features.conditional;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.Precedence;
import org.bacon.compiler.frontend.parser.ast.BlockStatementNode;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.IfExpressionNode;

/**
 * Parses {@code if (<condition>) { ... }} with an optional {@code else { ... }} branch.
 */
public class IfExpressionParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        Token ifToken = context.currentToken();

        if (!context.expectPeek(TokenType.LEFT_PAREN)) {
            return null;
        }
        context.nextToken();
        Expression condition = context.parseExpression(Precedence.LOWEST);

        if (!context.expectPeek(TokenType.RIGHT_PAREN)) {
            return null;
        }
        if (!context.expectPeek(TokenType.LEFT_BRACE)) {
            return null;
        }
        BlockStatementNode consequence = context.parseBlockStatement();
        if (consequence == null) {
            return null;
        }

        BlockStatementNode alternative = null;
        if (context.peekIs(TokenType.ELSE)) {
            context.nextToken();
            if (!context.expectPeek(TokenType.LEFT_BRACE)) {
                return null;
            }
            alternative = context.parseBlockStatement();
            if (alternative == null) {
                return null;
            }
        }

        if (condition == null) {
            return null;
        }
        return new IfExpressionNode(ifToken, condition, consequence, alternative);
    }
}
