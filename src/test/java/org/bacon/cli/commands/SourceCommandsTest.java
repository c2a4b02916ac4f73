package org.bacon.cli.commands;

import org.bacon.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code tokens} and {@code parse} subcommands through picocli with captured output streams.
 */
@Tag("unit")
class SourceCommandsTest {

    private CommandLine commandLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void tokens_printsOneTokenPerLine() {
        int exitCode = commandLine.execute("tokens", "-e", "a == 1");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly(
                "Token[type=IDENTIFIER, text=a, line=1, column=1]",
                "Token[type=EQUAL, text===, line=1, column=3]",
                "Token[type=INTEGER, text=1, line=1, column=6]",
                "Token[type=END_OF_FILE, text=, line=1, column=7]");
    }

    @Test
    void tokens_json_printsTokenArray() {
        int exitCode = commandLine.execute("tokens", "--json", "-e", "let");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .startsWith("[")
                .contains("\"type\": \"LET\"")
                .contains("\"text\": \"let\"")
                .contains("\"type\": \"END_OF_FILE\"");
    }

    @Test
    void parse_validExpression_printsProgram() {
        int exitCode = commandLine.execute("parse", "-e", "a + b * c");

        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("(a + (b * c))");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void parse_tree_printsNodeTree() {
        int exitCode = commandLine.execute("parse", "--tree", "-e", "return 1;");

        assertThat(exitCode).isZero();
        assertThat(out.toString().lines()).containsExactly("Program", "  Return", "    Integer 1");
    }

    @Test
    void parse_file_reportsDiagnosticsWithFileName(@TempDir Path tempDir) throws IOException {
        // Arrange
        Path file = tempDir.resolve("broken.bacon");
        Files.writeString(file, "let x = 1;\nlet = 2;\n");

        // Act
        int exitCode = commandLine.execute("parse", file.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).startsWith("let x = 1;");
        assertThat(err.toString().lines()).first()
                .isEqualTo("[ERROR] broken.bacon:2:5: expected next token to be IDENT, got = instead");
    }

    @Test
    void parse_withoutSource_isUsageError() {
        int exitCode = commandLine.execute("parse");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Exactly one of FILE or --expression must be given.");
    }

    @Test
    void tokens_withFileAndExpression_isUsageError(@TempDir Path tempDir) {
        int exitCode = commandLine.execute("tokens", "-e", "1", tempDir.resolve("x.bacon").toString());

        assertThat(exitCode).isEqualTo(2);
    }
}
