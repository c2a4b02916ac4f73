package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node for {@code true} or {@code false}.
 *
 * @param token The keyword token.
 * @param value The boolean value.
 */
public record BooleanLiteralNode(
        Token token,
        boolean value
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
        return token.text();
    }
}
