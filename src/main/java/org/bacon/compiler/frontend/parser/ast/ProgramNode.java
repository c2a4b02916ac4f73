package org.bacon.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of every tree produced by the parser: the top-level statements in source order.
 * A program without statements is valid.
 *
 * @param statements The parsed statements.
 */
public record ProgramNode(
        List<Statement> statements
) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }

    @Override
    public String tokenLiteral() {
        return statements.isEmpty() ? "" : statements.get(0).tokenLiteral();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return Statement.render(statements);
    }
}
