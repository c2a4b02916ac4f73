package org.bacon.compiler.frontend.parser.features.function;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.ast.BlockStatementNode;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.FunctionLiteralNode;
import org.bacon.compiler.frontend.parser.ast.IdentifierNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code fn(<a>, <b>, ...) { <body> }}.
 */
public class FunctionLiteralParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        Token fnToken = context.currentToken();

        if (!context.expectPeek(TokenType.LEFT_PAREN)) {
            return null;
        }
        List<IdentifierNode> parameters = parseParameters(context);
        if (parameters == null) {
            return null;
        }

        if (!context.expectPeek(TokenType.LEFT_BRACE)) {
            return null;
        }
        BlockStatementNode body = context.parseBlockStatement();
        if (body == null) {
            return null;
        }
        return new FunctionLiteralNode(fnToken, parameters, body);
    }

    private List<IdentifierNode> parseParameters(ParsingContext context) {
        List<IdentifierNode> parameters = new ArrayList<>();
        if (context.peekIs(TokenType.RIGHT_PAREN)) {
            context.nextToken();
            return parameters;
        }

        do {
            if (!parameters.isEmpty()) {
                context.nextToken(); // the comma
            }
            if (!context.expectPeek(TokenType.IDENTIFIER)) {
                return null;
            }
            Token name = context.currentToken();
            parameters.add(new IdentifierNode(name, name.text()));
        } while (context.peekIs(TokenType.COMMA));

        if (!context.expectPeek(TokenType.RIGHT_PAREN)) {
            return null;
        }
        return parameters;
    }
}
