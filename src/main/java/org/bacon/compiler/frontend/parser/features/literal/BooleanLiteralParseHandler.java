package org.bacon.compiler.frontend.parser.features.literal;

import org.bacon.compiler.frontend.lexer.TokenType;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.bacon.compiler.frontend.parser.ast.Expression;

/**
 * Handles the {@code true} and {@code false} keywords.
 */
public class BooleanLiteralParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        return new BooleanLiteralNode(context.currentToken(), context.currentIs(TokenType.TRUE));
    }
}
