package dev.drtheo.jilox.ast;

import dev.drtheo.jilox.lexer.Token;
import dev.drtheo.jilox.runtime.LoxValue;

import java.util.Objects;

/**
 * Expression tree. Nodes are immutable and own their children exclusively;
 * {@link #getToken()} is the token diagnostics about the node point at.
 */
public abstract sealed class Expr permits Expr.Binary, Expr.Grouping, Expr.Literal, Expr.Unary {

    public interface Visitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitGroupingExpr(Grouping expr);
        R visitLiteralExpr(Literal expr);
        R visitUnaryExpr(Unary expr);
    }

    public static final class Binary extends Expr {
        private final Expr left;
        private final Token operator;
        private final Expr right;

        public Binary(Expr left, Token operator, Expr right) {
            this.left = Objects.requireNonNull(left, "left");
            this.operator = Objects.requireNonNull(operator, "operator");
            this.right = Objects.requireNonNull(right, "right");
        }

        public Token getOperator() {
            return this.operator;
        }

        public Expr getLeft() {
            return this.left;
        }

        public Expr getRight() {
            return this.right;
        }

        @Override
        public Token getToken() {
            return this.operator;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Grouping extends Expr {
        private final Token paren;
        private final Expr expression;

        public Grouping(Token paren, Expr expression) {
            this.paren = Objects.requireNonNull(paren, "paren");
            this.expression = Objects.requireNonNull(expression, "expression");
        }

        public Expr getExpression() {
            return this.expression;
        }

        /**
         * @return the opening parenthesis
         */
        @Override
        public Token getToken() {
            return this.paren;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }
    }

    public static final class Literal extends Expr {
        private final Token token;
        private final LoxValue value;

        public Literal(Token token, LoxValue value) {
            this.token = Objects.requireNonNull(token, "token");
            this.value = Objects.requireNonNull(value, "value");
        }

        public LoxValue getValue() {
            return this.value;
        }

        @Override
        public Token getToken() {
            return this.token;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Unary extends Expr {
        private final Token operator;
        private final Expr right;

        public Unary(Token operator, Expr right) {
            this.operator = Objects.requireNonNull(operator, "operator");
            this.right = Objects.requireNonNull(right, "right");
        }

        public Token getOperator() {
            return this.operator;
        }

        public Expr getRight() {
            return this.right;
        }

        @Override
        public Token getToken() {
            return this.operator;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public abstract Token getToken();

    public abstract <R> R accept(Visitor<R> visitor);
}
