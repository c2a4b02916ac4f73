package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node for {@code return <value>;}.
 *
 * @param token The {@code return} token.
 * @param value The returned expression.
 */
public record ReturnStatementNode(
        Token token,
        Expression value
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
        return tokenLiteral() + " " + value + ";";
    }
}
