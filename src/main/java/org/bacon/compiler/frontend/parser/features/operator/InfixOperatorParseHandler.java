package org.bacon.compiler.frontend.parser.features.operator;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.parser.IInfixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.Precedence;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.InfixExpressionNode;

/**
 * Parses the right operand of a binary operator and combines it with the left one.
 */
public class InfixOperatorParseHandler implements IInfixParseHandler {

    @Override
    public Expression parse(ParsingContext context, Expression left) {
        Token operator = context.currentToken();
        Precedence precedence = context.currentPrecedence();
        context.nextToken();

        // Recursing with the operator's own precedence (not one higher) stops at the next
        // operator of equal strength, which makes all binary operators left-associative.
        Expression right = context.parseExpression(precedence);
        if (right == null) {
            return null;
        }
        return new InfixExpressionNode(operator, left, operator.text(), right);
    }
}
