package org.bacon.compiler.frontend.parser.ast;

import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the source rendering of hand-built nodes, independent of the parser.
 */
@Tag("unit")
class AstNodeTest {

    private static Token token(TokenType type, String text) {
        return new Token(type, text, 1, 1);
    }

    private static IdentifierNode identifier(String name) {
        return new IdentifierNode(token(TokenType.IDENTIFIER, name), name);
    }

    @Test
    void letStatement_rendersAsSource() {
        // Arrange
        LetStatementNode let = new LetStatementNode(token(TokenType.LET, "let"),
                identifier("myVar"), identifier("anotherVar"));

        // Act
        ProgramNode program = new ProgramNode(List.of(let));

        // Assert
        assertThat(program.toString()).isEqualTo("let myVar = anotherVar;");
        assertThat(program.tokenLiteral()).isEqualTo("let");
    }

    @Test
    void emptyProgram_rendersAsEmptyString() {
        ProgramNode program = new ProgramNode(List.of());

        assertThat(program.toString()).isEmpty();
        assertThat(program.tokenLiteral()).isEmpty();
    }

    @Test
    void nestedExpressions_areFullyParenthesized() {
        // Arrange
        IntegerLiteralNode two = new IntegerLiteralNode(token(TokenType.INTEGER, "2"), 2);
        PrefixExpressionNode negated = new PrefixExpressionNode(token(TokenType.MINUS, "-"), "-", identifier("a"));
        InfixExpressionNode product = new InfixExpressionNode(token(TokenType.ASTERISK, "*"), negated, "*", two);
        ReturnStatementNode ret = new ReturnStatementNode(token(TokenType.RETURN, "return"), product);

        // Act / Assert
        assertThat(ret.toString()).isEqualTo("return ((-a) * 2);");
    }

    @Test
    void functionCallAndIf_renderWithoutExtraSpacing() {
        // Arrange
        BlockStatementNode body = new BlockStatementNode(token(TokenType.LEFT_BRACE, "{"),
                List.of(new ExpressionStatementNode(token(TokenType.IDENTIFIER, "x"), identifier("x"))));
        FunctionLiteralNode function = new FunctionLiteralNode(token(TokenType.FUNCTION, "fn"),
                List.of(identifier("x"), identifier("y")), body);
        CallExpressionNode call = new CallExpressionNode(token(TokenType.LEFT_PAREN, "("), identifier("f"),
                List.of(identifier("a"), new BooleanLiteralNode(token(TokenType.TRUE, "true"), true)));
        IfExpressionNode ifExpression = new IfExpressionNode(token(TokenType.IF, "if"),
                identifier("c"), body, null);

        // Assert
        assertThat(function.toString()).isEqualTo("fn(x, y) { x }");
        assertThat(call.toString()).isEqualTo("f(a, true)");
        assertThat(ifExpression.toString()).isEqualTo("if (c) { x }");
        assertThat(ifExpression.hasAlternative()).isFalse();
    }

    @Test
    void program_copiesItsStatementList() {
        // Arrange
        List<Statement> statements = new ArrayList<>();
        statements.add(new ExpressionStatementNode(token(TokenType.IDENTIFIER, "a"), identifier("a")));
        ProgramNode program = new ProgramNode(statements);

        // Act
        statements.clear();

        // Assert
        assertThat(program.statements()).hasSize(1);
        assertThatThrownBy(() -> program.statements().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
