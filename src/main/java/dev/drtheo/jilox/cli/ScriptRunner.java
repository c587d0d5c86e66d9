package dev.drtheo.jilox.cli;

import dev.drtheo.jilox.Lox;
import dev.drtheo.jilox.ast.Expr;
import dev.drtheo.jilox.runtime.LoxValue;
import dev.drtheo.jilox.util.AstPrinter;
import dev.drtheo.jilox.util.ParseError;
import dev.drtheo.jilox.util.RuntimeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs a whole source, from a file or the command line, as one expression and
 * maps the outcome to a process exit code.
 */
public class ScriptRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

    private final LoxConfig config;
    private final PrintWriter out;
    private final PrintWriter err;
    private final boolean printAst;

    public ScriptRunner(LoxConfig config, PrintWriter out, PrintWriter err, boolean printAst) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.printAst = printAst;
    }

    public int runFile(Path path) {
        String source;

        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.debug("Failed to read {}", path, e);
            err.println("Could not read '" + path + "': " + e.getMessage());
            return config.getIoErrorExitCode();
        }

        LOG.debug("Running {} ({} characters)", path, source.length());
        return runSource(source);
    }

    /**
     * @return {@code 0} on success, otherwise the configured data error (parse)
     * or software error (runtime) exit code
     */
    public int runSource(String source) {
        try {
            Expr expr = Lox.parse(source);

            if (printAst)
                out.println(new AstPrinter().print(expr));

            LoxValue value = Lox.evaluate(expr);
            out.println(value);

            return 0;
        } catch (ParseError e) {
            err.println(e.report());
            return config.getDataErrorExitCode();
        } catch (RuntimeError e) {
            err.println(e.report());
            return config.getSoftwareErrorExitCode();
        } finally {
            out.flush();
            err.flush();
        }
    }
}
