package dev.drtheo.jilox.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * {@code jilox [script]}: evaluates the script, the {@code -e} expression, or
 * starts the interactive prompt when given neither.
 */
@Command(name = "jilox", version = "jilox 1.0.0",
        mixinStandardHelpOptions = true,
        customSynopsis = "jilox [-hV] [--print-ast] [-e=<expression>] [script]",
        description = "Evaluates a Lox expression from a script file, the command line or an interactive prompt.")
public class Main implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-e", "--eval"}, paramLabel = "<expression>", description = "Evaluate the given expression and exit.")
    String expression;

    @Option(names = "--print-ast", description = "Print the parsed tree before its value.")
    boolean printAst;

    @Parameters(arity = "0..1", paramLabel = "script", description = "Source file holding one expression.")
    Path script;

    private final LoxConfig config;

    public Main(LoxConfig config) {
        this.config = config;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        boolean ast = printAst || config.isPrintAst();

        if (expression != null) {
            if (script != null)
                LOG.warn("Ignoring script {} since an expression was given", script);

            return new ScriptRunner(config, out, err, ast).runSource(expression);
        }

        if (script != null)
            return new ScriptRunner(config, out, err, ast).runFile(script);

        return new ReplRunner(config, ast).run(out);
    }

    public static CommandLine newCommandLine(LoxConfig config) {
        CommandLine commandLine = new CommandLine(new Main(config));
        commandLine.getCommandSpec().exitCodeOnInvalidInput(config.getUsageExitCode());

        return commandLine;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine(LoxConfig.load()).execute(args));
    }
}
