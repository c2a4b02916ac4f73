package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node for a binary operator between two operands, e.g. {@code a + b}.
 *
 * @param token The operator token.
 * @param left The left operand.
 * @param operator The operator text.
 * @param right The right operand.
 */
public record InfixExpressionNode(
        Token token,
        Expression left,
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
        return "(" + left + " " + operator + " " + right + ")";
    }
}
