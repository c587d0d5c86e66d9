package dev.drtheo.jilox.cli;

import dev.drtheo.jilox.Lox;
import dev.drtheo.jilox.ast.Expr;
import dev.drtheo.jilox.util.AstPrinter;
import dev.drtheo.jilox.util.LoxError;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Interactive prompt. Every line is a separate expression; an error is
 * reported and the prompt carries on.
 */
public class ReplRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ReplRunner.class);

    static final String QUIT_COMMAND = ":quit";

    private final LoxConfig config;
    private final boolean printAst;
    private final AstPrinter printer = new AstPrinter();

    public ReplRunner(LoxConfig config, boolean printAst) {
        this.config = config;
        this.printAst = printAst;
    }

    /**
     * Runs on the system terminal, or on plain standard input when no
     * terminal can be opened.
     */
    public int run(PrintWriter fallbackOut) {
        Terminal terminal;

        try {
            terminal = TerminalBuilder.builder().system(true).build();
        } catch (IOException e) {
            LOG.warn("Could not open a terminal, reading plain standard input", e);

            try {
                this.runLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), fallbackOut);
                return 0;
            } catch (IOException io) {
                LOG.error("Failed to read standard input", io);
                return config.getIoErrorExitCode();
            }
        }

        try (terminal) {
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .appName("jilox")
                    .build();

            this.runLoop(reader, terminal.writer());
        } catch (IOException e) {
            LOG.debug("Failed to close the terminal", e);
        }

        return 0;
    }

    void runLoop(LineReader reader, PrintWriter out) {
        out.println(config.getBanner());

        while (true) {
            String line;

            try {
                line = reader.readLine(config.getPrompt());
            } catch (UserInterruptException e) {
                // Ctrl-C drops the current line.
                continue;
            } catch (EndOfFileException e) {
                break;
            }

            if (!this.handle(line, out))
                break;
        }

        out.flush();
    }

    void runLoop(BufferedReader reader, PrintWriter out) throws IOException {
        out.println(config.getBanner());

        while (true) {
            out.print(config.getPrompt());
            out.flush();

            String line = reader.readLine();
            if (line == null || !this.handle(line, out))
                break;
        }

        out.println();
        out.flush();
    }

    /**
     * @return {@code false} once the session should end
     */
    boolean handle(String line, PrintWriter out) {
        String input = line.trim();

        if (input.isEmpty())
            return true;

        if (input.equals(QUIT_COMMAND))
            return false;

        out.println(this.evaluate(input));
        out.flush();

        return true;
    }

    String evaluate(String input) {
        try {
            Expr expr = Lox.parse(input);
            String value = Lox.evaluate(expr).toString();

            if (printAst)
                return printer.print(expr) + System.lineSeparator() + value;

            return value;
        } catch (LoxError e) {
            return e.report();
        }
    }
}
