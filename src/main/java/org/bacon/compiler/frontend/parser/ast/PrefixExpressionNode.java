package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node for a unary operator applied to an operand, e.g. {@code !ok} or {@code -5}.
 *
 * @param token The operator token.
 * @param operator The operator text.
 * @param right The operand.
 */
public record PrefixExpressionNode(
        Token token,
        String operator,
        Expression right
) implements Expression {

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
        return "(" + operator + right + ")";
    }
}
