package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an integer literal.
 *
 * @param token The token containing the digits.
 * @param value The converted 64-bit value.
 */
public record IntegerLiteralNode(
        Token token,
        long value
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
