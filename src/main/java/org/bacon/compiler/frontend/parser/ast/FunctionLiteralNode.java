package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An AST node for {@code fn(<parameters>) { <body> }}.
 *
 * @param token The {@code fn} token.
 * @param parameters The parameter names in declaration order.
 * @param body The function body.
 */
public record FunctionLiteralNode(
        Token token,
        List<IdentifierNode> parameters,
        BlockStatementNode body
) implements Expression {

    public FunctionLiteralNode {
        parameters = List.copyOf(parameters);
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
        String params = parameters.stream().map(IdentifierNode::toString).collect(Collectors.joining(", "));
        return tokenLiteral() + "(" + params + ") " + body;
    }
}
