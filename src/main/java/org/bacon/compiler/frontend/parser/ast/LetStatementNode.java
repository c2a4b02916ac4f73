package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

/**
 * An AST node that binds a name to a value: {@code let <name> = <value>;}.
 *
 * @param token The {@code let} token.
 * @param name The bound identifier.
 * @param value The expression producing the value.
 */
public record LetStatementNode(
        Token token,
        IdentifierNode name,
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
        return tokenLiteral() + " " + name + " = " + value + ";";
    }
}
