package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * A statement consisting of a single expression, e.g. {@code x + 10;}.
 * The trailing semicolon is optional.
 *
 * @param token The first token of the expression.
 * @param expression The expression.
 */
public record ExpressionStatementNode(
        Token token,
        Expression expression
) implements Statement {

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
        return expression.toString();
    }
}
