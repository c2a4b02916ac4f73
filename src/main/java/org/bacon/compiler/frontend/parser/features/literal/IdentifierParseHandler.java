package org.bacon.compiler.frontend.parser.features.literal;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.IdentifierNode;

/**
 * Turns the current identifier token into an {@link IdentifierNode}.
 */
public class IdentifierParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        Token token = context.currentToken();
        return new IdentifierNode(token, token.text());
    }
}
