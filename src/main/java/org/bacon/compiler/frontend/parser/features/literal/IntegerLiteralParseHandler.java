package org.bacon.compiler.frontend.parser.features.literal;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.parser.IPrefixParseHandler;
import org.bacon.compiler.frontend.parser.ParsingContext;
import org.bacon.compiler.frontend.parser.ast.Expression;
import org.bacon.compiler.frontend.parser.ast.IntegerLiteralNode;

/**
 * Converts the text of an integer token into a 64-bit value.
 * Values that do not fit are reported instead of being truncated.
 */
public class IntegerLiteralParseHandler implements IPrefixParseHandler {

    @Override
    public Expression parse(ParsingContext context) {
        Token token = context.currentToken();
        try {
            return new IntegerLiteralNode(token, Long.parseLong(token.text()));
        } catch (NumberFormatException e) {
            context.getDiagnostics().reportError(
                    String.format("could not parse \"%s\" as integer", token.text()), token.line(), token.column());
            return null;
        }
    }
}
