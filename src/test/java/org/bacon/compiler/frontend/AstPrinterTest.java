package org.bacon.compiler.frontend;

import org.bacon.compiler.frontend.lexer.Lexer;
import org.bacon.compiler.frontend.parser.Parser;
import org.bacon.compiler.frontend.parser.ast.ProgramNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AstPrinterTest {

    private static ProgramNode parse(String source) {
        Parser parser = new Parser(new Lexer(source));
        ProgramNode program = parser.parseProgram();
        assertThat(parser.errors()).as("Parser errors for: %s", source).isEmpty();
        return program;
    }

    @Test
    void printsOneNodePerLineWithIndentation() {
        String tree = AstPrinter.print(parse("let a = -b + 1;"));

        assertThat(tree).isEqualTo(String.join("\n",
                "Program",
                "  Let a",
                "    Infix +",
                "      Prefix -",
                "        Identifier b",
                "      Integer 1",
                ""));
    }

    @Test
    void printsFunctionsCallsAndConditionals() {
        String tree = AstPrinter.print(parse("fn(x) { if (x) { return true; } else { false } }(1)"));

        assertThat(tree).isEqualTo(String.join("\n",
                "Program",
                "  ExpressionStatement",
                "    Call",
                "      Function",
                "        Identifier x",
                "        Block",
                "          ExpressionStatement",
                "            If",
                "              Identifier x",
                "              Block",
                "                Return",
                "                  Boolean true",
                "              Else",
                "                Block",
                "                  ExpressionStatement",
                "                    Boolean false",
                "      Integer 1",
                ""));
    }

    @Test
    void emptyProgramPrintsOnlyTheRoot() {
        assertThat(AstPrinter.print(parse(""))).isEqualTo("Program\n");
    }
}
