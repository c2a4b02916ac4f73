package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node that represents an identifier, either as a reference or as a bound name.
 *
 * @param token The identifier token.
 * @param name The identifier's name.
 */
public record IdentifierNode(
        Token token,
        String name
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
        return name;
    }
}
