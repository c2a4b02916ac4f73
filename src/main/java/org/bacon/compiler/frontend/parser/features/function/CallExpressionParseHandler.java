package org.bacon.compiler.frontend.parser.features.function;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.IInfixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.Precedence;
import org.bacon.compiler.frontend.parser.ast.CallExpressionNode;
import org.bacon.compiler.frontend.parser.ast.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the argument list of a call. Registered for {@code (} in operator position,
 * where it binds with {@link Precedence#CALL}, tighter than any other operator.
 */
public class CallExpressionParseHandler implements IInfixParseHandler {

    @Override
    public Expression parse(ParsingContext context, Expression function) {
        Token parenToken = context.currentToken();
        List<Expression> arguments = new ArrayList<>();
        boolean valid = true;

        if (context.peekIs(TokenType.RIGHT_PAREN)) {
            context.nextToken();
            return new CallExpressionNode(parenToken, function, arguments);
        }

        context.nextToken();
        Expression argument = context.parseExpression(Precedence.LOWEST);
        valid &= argument != null;
        arguments.add(argument);
        while (context.peekIs(TokenType.COMMA)) {
            context.nextToken();
            context.nextToken();
            argument = context.parseExpression(Precedence.LOWEST);
            valid &= argument != null;
            arguments.add(argument);
        }

        if (!context.expectPeek(TokenType.RIGHT_PAREN) || !valid) {
            return null;
        }
        return new CallExpressionNode(parenToken, function, arguments);
    }
}
