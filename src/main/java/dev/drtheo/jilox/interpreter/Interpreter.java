package dev.drtheo.jilox.interpreter;

import dev.drtheo.jilox.ast.Expr;
import dev.drtheo.jilox.lexer.Token;
import dev.drtheo.jilox.lexer.TokenType;
import dev.drtheo.jilox.runtime.LoxBoolean;
import dev.drtheo.jilox.runtime.LoxNil;
import dev.drtheo.jilox.runtime.LoxNumber;
import dev.drtheo.jilox.runtime.LoxString;
import dev.drtheo.jilox.runtime.LoxValue;
import dev.drtheo.jilox.util.RuntimeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tree-walk evaluator. It keeps no state between calls, so one instance can
 * evaluate any number of trees from any number of threads.
 * <p>
 * Operands are always evaluated left to right before the operator applies.
 * Binary operators are defined for these operand pairs only:
 * <ul>
 *     <li>number, number: {@code + - * /}, ordering and equality</li>
 *     <li>string, string: {@code +} (concatenation)</li>
 *     <li>nil, nil: equality</li>
 * </ul>
 * Anything else raises a {@link RuntimeError} at the operator.
 */
public class Interpreter implements Expr.Visitor<LoxValue> {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    /**
     * @throws RuntimeError at the first operator applied to operands it is not defined for
     */
    public LoxValue evaluate(Expr expr) {
        LoxValue value = expr.accept(this);
        LOG.trace("Evaluated {} to a {}", expr.getClass().getSimpleName(), value.kind().getDisplayName());

        return value;
    }

    @Override
    public LoxValue visitBinaryExpr(Expr.Binary expr) {
        LoxValue left = expr.getLeft().accept(this);
        LoxValue right = expr.getRight().accept(this);

        Token operator = expr.getOperator();

        if (left instanceof LoxNumber a && right instanceof LoxNumber b)
            return this.arithmetic(operator, a.value(), b.value(), left, right);

        if (left instanceof LoxString a && right instanceof LoxString b) {
            if (operator.is(TokenType.PLUS))
                return new LoxString(a.value() + b.value());

            throw incompatible(operator, left, right);
        }

        if (left == LoxNil.INSTANCE && right == LoxNil.INSTANCE) {
            return switch (operator.type()) {
                case EQUAL_EQUAL -> LoxBoolean.TRUE;
                case BANG_EQUAL -> LoxBoolean.FALSE;
                default -> throw incompatible(operator, left, right);
            };
        }

        throw incompatible(operator, left, right);
    }

    private LoxValue arithmetic(Token operator, float a, float b, LoxValue left, LoxValue right) {
        return switch (operator.type()) {
            case PLUS -> new LoxNumber(a + b);
            case MINUS -> new LoxNumber(a - b);
            case STAR -> new LoxNumber(a * b);
            // IEEE semantics: x / 0 is an infinity or NaN, not an error.
            case SLASH -> new LoxNumber(a / b);

            case GREATER -> LoxBoolean.of(a > b);
            case GREATER_EQUAL -> LoxBoolean.of(a >= b);
            case LESS -> LoxBoolean.of(a < b);
            case LESS_EQUAL -> LoxBoolean.of(a <= b);

            case EQUAL_EQUAL -> LoxBoolean.of(a == b);
            case BANG_EQUAL -> LoxBoolean.of(a != b);

            default -> throw incompatible(operator, left, right);
        };
    }

    @Override
    public LoxValue visitGroupingExpr(Expr.Grouping expr) {
        return expr.getExpression().accept(this);
    }

    @Override
    public LoxValue visitLiteralExpr(Expr.Literal expr) {
        return expr.getValue();
    }

    @Override
    public LoxValue visitUnaryExpr(Expr.Unary expr) {
        LoxValue right = expr.getRight().accept(this);
        Token operator = expr.getOperator();

        return switch (operator.type()) {
            case MINUS -> {
                if (right instanceof LoxNumber number)
                    yield new LoxNumber(-number.value());

                throw new RuntimeError(operator, "Operand of '-' must be a number.");
            }
            case BANG -> {
                if (right instanceof LoxBoolean bool)
                    yield bool.not();

                throw new RuntimeError(operator, "Operand of '!' must be a boolean.");
            }
            default -> throw new RuntimeError(operator, "Unknown unary operator.");
        };
    }

    private static RuntimeError incompatible(Token operator, LoxValue left, LoxValue right) {
        return new RuntimeError(operator, "Incompatible types for '" + operator.lexeme() + "': "
                + left.kind().getDisplayName() + " and " + right.kind().getDisplayName() + ".");
    }
}
