package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A brace-delimited list of statements, used as the body of conditionals and functions.
 *
 * @param token The opening brace token.
 * @param statements The statements in source order.
 */
public record BlockStatementNode(
        Token token,
        List<Statement> statements
) implements Statement {

    public BlockStatementNode {
        statements = List.copyOf(statements);
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
        if (statements.isEmpty()) {
            return "{ }";
        }
        return "{ " + Statement.render(statements) + " }";
    }
}
