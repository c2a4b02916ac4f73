package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node for {@code if (<condition>) { ... } else { ... }}.
 *
 * @param token The {@code if} token.
 * @param condition The condition expression.
 * @param consequence The block evaluated when the condition holds.
 * @param alternative The {@code else} block, or {@code null} if there is none.
 */
public record IfExpressionNode(
        Token token,
        Expression condition,
        BlockStatementNode consequence,
        BlockStatementNode alternative
) implements Expression {

    /**
     * Checks whether this conditional has an {@code else} branch.
     * @return true if {@link #alternative()} is not null.
     */
    public boolean hasAlternative() {
        return alternative != null;
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
        StringBuilder sb = new StringBuilder();
        sb.append("if ");
        // Prefix and infix renderings already carry their own parentheses.
        if (condition instanceof PrefixExpressionNode || condition instanceof InfixExpressionNode) {
            sb.append(condition);
        } else {
            sb.append('(').append(condition).append(')');
        }
        sb.append(' ').append(consequence);
        if (hasAlternative()) {
            sb.append(" else ").append(alternative);
        }
        return sb.toString();
    }
}
