package dev.drtheo.jilox;

import dev.drtheo.jilox.ast.Expr;
import dev.drtheo.jilox.interpreter.Interpreter;
import dev.drtheo.jilox.lexer.Lexer;
import dev.drtheo.jilox.lexer.Token;
import dev.drtheo.jilox.parser.Parser;
import dev.drtheo.jilox.runtime.LoxValue;
import dev.drtheo.jilox.util.LoxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry points into the scan, parse and evaluate pipeline. Each stage works on
 * in-memory input only and throws a {@link LoxError} on its first failure.
 */
public final class Lox {

    private static final Logger LOG = LoggerFactory.getLogger(Lox.class);
    private static final Interpreter INTERPRETER = new Interpreter();

    private Lox() { }

    /**
     * @throws dev.drtheo.jilox.util.ParseError if the source cannot be scanned
     */
    public static List<Token> scan(String source) {
        return new Lexer(source).scanTokens();
    }

    /**
     * @param tokens a sequence ending with an EOF token
     * @throws dev.drtheo.jilox.util.ParseError if the tokens are not exactly one expression
     */
    public static Expr parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    /**
     * @throws dev.drtheo.jilox.util.RuntimeError if an operator meets operands it is not defined for
     */
    public static LoxValue evaluate(Expr expr) {
        return INTERPRETER.evaluate(expr);
    }

    public static Expr parse(String source) {
        return parse(scan(source));
    }

    public static LoxValue run(String source) {
        try {
            return evaluate(parse(source));
        } catch (LoxError e) {
            LOG.debug("Pipeline stopped with a {} at line {}", e.getKind(), e.getLine());
            throw e;
        }
    }
}
