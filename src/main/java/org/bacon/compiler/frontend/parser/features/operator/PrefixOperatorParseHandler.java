package org.bacon.compiler.frontend.parser.features.operator;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.Precedence;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.PrefixExpressionNode;

/**
 * Parses {@code !<operand>} and {@code -<operand>}. The operand is parsed at
 * {@link Precedence#PREFIX}, so only a call can bind tighter than the operator.
 */
public class PrefixOperatorParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        Token operator = context.currentToken();
        context.nextToken();

        Expression right = context.parseExpression(Precedence.PREFIX);
        if (right == null) {
            return null;
        }
        return new PrefixExpressionNode(operator, operator.text(), right);
    }
}
