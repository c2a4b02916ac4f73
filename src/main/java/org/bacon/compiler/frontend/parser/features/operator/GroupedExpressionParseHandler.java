package org.bacon.compiler.frontend.parser.features.operator;

import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.Precedence;
import org.bacon.compiler.frontend.parser.ast.Expression;

/**
 * Parses {@code ( <expression> )}. No node is created for the parentheses; the inner
 * expression is returned with its binding already fixed.
 */
public class GroupedExpressionParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        context.nextToken();

        Expression expression = context.parseExpression(Precedence.LOWEST);
        if (!context.expectPeek(TokenType.RIGHT_PAREN)) {
            return null;
        }
        return expression;
    }
}
