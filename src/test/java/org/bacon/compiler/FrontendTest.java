package org.bacon.compiler;

import org.bacon.compiler.api.ParseResult;
import org.bacon.compiler.diagnostics.Diagnostic;
import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the {@link Frontend} facade used by the command line and the REPL.
 */
@Tag("unit")
class FrontendTest {

    private final Frontend frontend = new Frontend();

    @Test
    void tokenize_endsWithSingleEndOfFile() {
        List<Token> tokens = frontend.tokenize("let a = 1;");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.LET, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER,
                TokenType.SEMICOLON, TokenType.END_OF_FILE);
    }

    @Test
    void parse_validSource_hasNoErrors() {
        // Act
        ParseResult result = frontend.parse("let a = 1 + 2 * 3;", "ok.bacon");

        // Assert
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.errors()).isEmpty();
        assertThat(result.program().toString()).isEqualTo("let a = (1 + (2 * 3));");
    }

    @Test
    void parse_invalidSource_reportsNamedDiagnostics() {
        // Act
        ParseResult result = frontend.parse("let = 1;\nx;", "bad.bacon");

        // Assert
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.diagnostics()).first().satisfies(diagnostic -> {
            assertThat(diagnostic.sourceName()).isEqualTo("bad.bacon");
            assertThat(diagnostic.lineNumber()).isEqualTo(1);
            assertThat(diagnostic.column()).isEqualTo(5);
        });
        assertThat(result.errors()).first().isEqualTo("expected next token to be IDENT, got = instead");
        // The second line still parses.
        assertThat(result.program().toString()).endsWith("x");
    }

    @Test
    void parse_callsAreIndependent() {
        ParseResult bad = frontend.parse("let", "first");
        ParseResult good = frontend.parse("1", "second");

        assertThat(bad.diagnostics()).extracting(Diagnostic::sourceName).containsOnly("first");
        assertThat(good.hasErrors()).isFalse();
    }
}
