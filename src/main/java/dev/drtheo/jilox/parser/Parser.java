package dev.drtheo.jilox.parser;

import dev.drtheo.jilox.ast.Expr;
import dev.drtheo.jilox.lexer.Token;
import dev.drtheo.jilox.runtime.LoxBoolean;
import dev.drtheo.jilox.runtime.LoxNil;
import dev.drtheo.jilox.runtime.LoxNumber;
import dev.drtheo.jilox.runtime.LoxString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static dev.drtheo.jilox.lexer.TokenType.*;

/**
 * Recursive-descent parser for a single expression.
 * <pre>
 * expression → equality
 * equality   → comparison ( ( "!=" | "==" ) comparison )*
 * comparison → term ( ( ">" | ">=" | "<" | "<=" ) term )*
 * term       → factor ( ( "-" | "+" ) factor )*
 * factor     → unary ( ( "/" | "*" ) unary )*
 * unary      → ( "!" | "-" ) unary | primary
 * primary    → NUMBER | STRING | "true" | "false" | "nil" | "(" expression ")"
 * </pre>
 * The first error aborts the parse; there is no synchronization yet since the
 * grammar has no statements to resume at.
 * <p>
 * No tree may be more than {@value #MAX_DEPTH} nodes deep, so that neither
 * this parser nor a visitor walking the result runs out of stack.
 */
public class Parser extends TokenEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    public static final int MAX_DEPTH = 255;

    private final Map<Expr, Integer> heights = new IdentityHashMap<>();
    private int depth = 0;

    public Parser(List<Token> tokens) {
        super(tokens);
    }

    /**
     * @return the tree for the whole token sequence
     * @throws dev.drtheo.jilox.util.ParseError if the tokens do not form exactly one expression
     */
    public Expr parse() {
        Expr expr = this.expression();

        if (!this.isAtEnd())
            throw error("Expected end of expression.");

        LOG.trace("Parsed {} tokens", this.tokens.size());
        return expr;
    }

    private Expr expression() {
        return this.equality();
    }

    private Expr equality() {
        Expr expr = this.comparison();

        while (this.match(BANG_EQUAL, EQUAL_EQUAL)) {
            Token operator = this.previous();
            Expr right = this.comparison();

            expr = this.node(new Expr.Binary(expr, operator, right), expr, right);
        }

        return expr;
    }

    private Expr comparison() {
        Expr expr = this.term();

        while (this.match(GREATER, GREATER_EQUAL, LESS, LESS_EQUAL)) {
            Token operator = this.previous();
            Expr right = this.term();

            expr = this.node(new Expr.Binary(expr, operator, right), expr, right);
        }

        return expr;
    }

    private Expr term() {
        Expr expr = this.factor();

        while (this.match(MINUS, PLUS)) {
            Token operator = this.previous();
            Expr right = this.factor();

            expr = this.node(new Expr.Binary(expr, operator, right), expr, right);
        }

        return expr;
    }

    private Expr factor() {
        Expr expr = this.unary();

        while (this.match(SLASH, STAR)) {
            Token operator = this.previous();
            Expr right = this.unary();

            expr = this.node(new Expr.Binary(expr, operator, right), expr, right);
        }

        return expr;
    }

    private Expr unary() {
        if (this.match(BANG, MINUS)) {
            Token operator = this.previous();

            this.enter(operator);
            Expr right = this.unary();
            this.depth--;

            return this.node(new Expr.Unary(operator, right), right);
        }

        return this.primary();
    }

    private Expr primary() {
        return this.match(token -> switch (token.type()) {
            case FALSE -> this.node(new Expr.Literal(token, LoxBoolean.FALSE));
            case TRUE -> this.node(new Expr.Literal(token, LoxBoolean.TRUE));
            case NIL -> this.node(new Expr.Literal(token, LoxNil.INSTANCE));

            case NUMBER -> {
                if (!(token.literal() instanceof Float number))
                    throw error(token, "Invalid literal.");

                yield this.node(new Expr.Literal(token, new LoxNumber(number)));
            }
            case STRING -> {
                if (!(token.literal() instanceof String text))
                    throw error(token, "Invalid literal.");

                yield this.node(new Expr.Literal(token, new LoxString(text)));
            }

            case LEFT_PAREN -> {
                this.enter(token);
                Expr expr = this.expression();
                this.consume(RIGHT_PAREN, "Expected closing ')'.");
                this.depth--;

                yield this.node(new Expr.Grouping(token, expr), expr);
            }

            default -> throw error(token, "Expected expression.");
        }, FALSE, TRUE, NIL, NUMBER, STRING, LEFT_PAREN);
    }

    /**
     * Counts one more level of recursion into {@link #unary()} or a group.
     */
    private void enter(Token token) {
        if (++this.depth > MAX_DEPTH)
            throw error(token, "Expression nests too deeply.");
    }

    /**
     * Records the height of a new node, one above its tallest child.
     */
    private Expr node(Expr expr, Expr... children) {
        int height = 1;

        for (Expr child : children)
            height = Math.max(height, this.heights.get(child) + 1);

        if (height > MAX_DEPTH)
            throw error(expr.getToken(), "Expression nests too deeply.");

        this.heights.put(expr, height);
        return expr;
    }
}
