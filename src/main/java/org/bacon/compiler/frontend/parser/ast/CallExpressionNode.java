package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An AST node for a function call, e.g. {@code add(1, 2 * 3)}.
 *
 * @param token The {@code (} token.
 * @param function The called expression: an identifier or a function literal.
 * @param arguments The argument expressions in source order.
 */
public record CallExpressionNode(
        Token token,
        Expression function,
        List<Expression> arguments
) implements Expression {

    public CallExpressionNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String tokenLiteral() {
        return token.text();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(Expression::toString).collect(Collectors.joining(", "));
        return function + "(" + args + ")";
    }
}
