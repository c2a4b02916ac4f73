package org.bacon.repl;

import org.bacon.compiler.Frontend;
import org.bacon.compiler.api.ParseResult;
import org.bacon.compiler.frontend.AstPrinter;
import org.bacon.compiler.frontend.lexer.Token;
import org.bacon.compiler.frontend.lexer.TokenType;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * The interactive read-eval-print loop. Every line is scanned and parsed on its own
 * (a fresh lexer and parser per line), so an error in one line never affects the next.
 * <p>
 * Lines starting with {@code :} are commands to the loop itself:
 * {@code :mode tokens|parse|tree}, {@code :help} and {@code :quit}.
 */
public class Repl {

    private static final Logger log = LoggerFactory.getLogger(Repl.class);

    private final LineReader reader;
    private final PrintWriter out;
    private final Frontend frontend;
    private final ReplConfig config;
    private ReplMode mode;

    /**
     * Creates a new loop.
     * @param reader The source of input lines.
     * @param out Where results are printed.
     * @param frontend The front end used to scan and parse each line.
     * @param config The loop's settings.
     */
    public Repl(LineReader reader, PrintWriter out, Frontend frontend, ReplConfig config) {
        this.reader = reader;
        this.out = out;
        this.frontend = frontend;
        this.config = config;
        this.mode = config.mode();
    }

    /**
     * Reads and processes lines until the input ends, the user interrupts, or {@code :quit} is entered.
     * @return The exit code, always 0.
     */
    public int run() {
        if (config.showWelcomeMessage()) {
            out.printf("Hello %s! This is the Bacon programming language!%n", System.getProperty("user.name"));
            out.println("Feel free to type in commands");
            out.flush();
        }

        while (true) {
            String line;
            try {
                line = reader.readLine(config.prompt());
            } catch (UserInterruptException | EndOfFileException e) {
                // Ctrl+C / Ctrl+D
                log.debug("Input closed: {}", e.getClass().getSimpleName());
                return 0;
            }
            if (line == null || !handleLine(line)) {
                return 0;
            }
            out.flush();
        }
    }

    /**
     * Processes one line of input.
     * @param line The line as typed.
     * @return false if the loop should stop.
     */
    boolean handleLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        if (trimmed.startsWith(":")) {
            return handleCommand(trimmed.substring(1).trim());
        }

        switch (mode) {
            case TOKENS:
                printTokens(line);
                break;
            case PARSE:
            case TREE:
                printParse(line);
                break;
        }
        return true;
    }

    /**
     * @return The current output mode.
     */
    ReplMode getMode() {
        return mode;
    }

    private boolean handleCommand(String command) {
        String[] parts = command.split("\\s+");
        switch (parts[0].toLowerCase()) {
            case "quit":
            case "exit":
                return false;
            case "help":
                printHelp();
                break;
            case "mode":
                if (parts.length < 2) {
                    out.println("Current mode: " + mode.name().toLowerCase());
                    break;
                }
                try {
                    mode = ReplMode.fromName(parts[1]);
                    out.println("Mode: " + mode.name().toLowerCase());
                } catch (IllegalArgumentException e) {
                    out.println("Unknown mode: " + parts[1] + ". Expected tokens, parse or tree.");
                }
                break;
            default:
                out.println("Unknown command: :" + parts[0] + ". Type :help for a list of commands.");
                break;
        }
        return true;
    }

    private void printTokens(String line) {
        for (Token token : frontend.tokenize(line)) {
            if (token.type() == TokenType.END_OF_FILE) {
                break;
            }
            out.println(token);
        }
    }

    private void printParse(String line) {
        ParseResult result = frontend.parse(line, "<repl>");
        if (result.hasErrors()) {
            out.println("parser errors:");
            for (String error : result.errors()) {
                out.println("\t" + error);
            }
            return;
        }
        if (mode == ReplMode.TREE) {
            out.print(AstPrinter.print(result.program()));
        } else {
            out.println(result.program());
        }
    }

    private void printHelp() {
        out.println("Type an expression or statement to see how it is parsed.");
        out.println("Available commands:");
        out.println("  :mode [tokens|parse|tree] - Show or change what is printed for each line.");
        out.println("  :help                     - Show this help message.");
        out.println("  :quit                     - Leave the REPL.");
    }
}
