package org.bacon.repl;

import org.bacon.compiler.Frontend;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ReplTest {

    private static final String PROMPT = ">> ";

    @Mock
    private LineReader mockReader;

    private StringWriter output;
    private Repl repl;

    @BeforeEach
    void setUp() {
        output = new StringWriter();
        repl = newRepl(ReplMode.PARSE, false);
    }

    private Repl newRepl(ReplMode mode, boolean welcome) {
        return new Repl(mockReader, new PrintWriter(output, true), new Frontend(),
                new ReplConfig(PROMPT, mode, welcome));
    }

    @Test
    void run_parseMode_printsRenderedProgramUntilQuit() {
        // Arrange
        when(mockReader.readLine(PROMPT)).thenReturn("let x = 1 + 2 * 3;", ":quit", "never read");

        // Act
        int exitCode = repl.run();

        // Assert
        assertThat(exitCode).isZero();
        assertThat(output.toString()).isEqualTo("let x = (1 + (2 * 3));" + System.lineSeparator());
        verify(mockReader, times(2)).readLine(PROMPT);
    }

    @Test
    void run_stopsOnEndOfInput() {
        when(mockReader.readLine(PROMPT)).thenReturn("a").thenThrow(new EndOfFileException());

        assertThat(repl.run()).isZero();
        assertThat(output.toString()).contains("a");
    }

    @Test
    void run_stopsOnInterrupt() {
        when(mockReader.readLine(PROMPT)).thenThrow(new UserInterruptException(""));

        assertThat(repl.run()).isZero();
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void run_printsWelcomeMessageWhenEnabled() {
        // Arrange
        Repl greeting = newRepl(ReplMode.PARSE, true);
        when(mockReader.readLine(PROMPT)).thenThrow(new EndOfFileException());

        // Act
        greeting.run();

        // Assert
        assertThat(output.toString())
                .contains("This is the Bacon programming language!")
                .contains("Feel free to type in commands");
    }

    @Test
    void handleLine_parseErrors_areListedWithTabs() {
        // Act
        boolean keepGoing = repl.handleLine("let = 5;");

        // Assert
        assertThat(keepGoing).isTrue();
        assertThat(output.toString().lines()).containsExactly(
                "parser errors:",
                "\texpected next token to be IDENT, got = instead",
                "\tno prefix parse function for = found");
    }

    @Test
    void handleLine_tokensMode_printsEveryTokenExceptEndOfFile() {
        // Arrange
        repl.handleLine(":mode tokens");
        output.getBuffer().setLength(0);

        // Act
        repl.handleLine("x + 1");

        // Assert
        assertThat(output.toString().lines()).containsExactly(
                "Token[type=IDENTIFIER, text=x, line=1, column=1]",
                "Token[type=PLUS, text=+, line=1, column=3]",
                "Token[type=INTEGER, text=1, line=1, column=5]");
    }

    @Test
    void handleLine_treeMode_printsNodeTree() {
        repl.handleLine(":mode TREE");
        output.getBuffer().setLength(0);

        repl.handleLine("!true");

        assertThat(output.toString().lines()).containsExactly(
                "Program", "  ExpressionStatement", "    Prefix !", "      Boolean true");
    }

    @Test
    void handleLine_modeCommand_reportsAndValidates() {
        // Act
        repl.handleLine(":mode");
        repl.handleLine(":mode tokens");
        repl.handleLine(":mode bogus");

        // Assert
        assertThat(repl.getMode()).isEqualTo(ReplMode.TOKENS);
        assertThat(output.toString().lines()).containsExactly(
                "Current mode: parse",
                "Mode: tokens",
                "Unknown mode: bogus. Expected tokens, parse or tree.");
    }

    @Test
    void handleLine_commands() {
        assertThat(repl.handleLine("   ")).isTrue();
        assertThat(repl.handleLine(":help")).isTrue();
        assertThat(repl.handleLine(":frobnicate")).isTrue();
        assertThat(repl.handleLine(":exit")).isFalse();
        assertThat(repl.handleLine(" :quit ")).isFalse();

        assertThat(output.toString())
                .contains(":mode [tokens|parse|tree]")
                .contains("Unknown command: :frobnicate. Type :help for a list of commands.");
    }

    @Test
    void handleLine_linesAreIndependent() {
        repl.handleLine("let");
        output.getBuffer().setLength(0);

        repl.handleLine("5");

        assertThat(output.toString().lines()).containsExactly("5");
    }
}
