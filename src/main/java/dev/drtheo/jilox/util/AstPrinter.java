package dev.drtheo.jilox.util;

import dev.drtheo.jilox.ast.Expr;
import dev.drtheo.jilox.runtime.LoxString;

/**
 * Renders a tree in its canonical parenthesized form, e.g.
 * {@code -123 * (45.67)} becomes {@code ( * (-123) (gr 45.67) )}.
 */
public class AstPrinter implements Expr.Visitor<String> {

    public String print(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return "( " + expr.getOperator().lexeme() + " " + print(expr.getLeft()) + " " + print(expr.getRight()) + " )";
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return "(gr " + print(expr.getExpression()) + ")";
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        if (expr.getValue() instanceof LoxString string)
            return "\"" + string.value() + "\"";

        return expr.getValue().toString();
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return "(" + expr.getOperator().lexeme() + print(expr.getRight()) + ")";
    }
}
