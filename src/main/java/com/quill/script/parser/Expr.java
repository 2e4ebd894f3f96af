package com.quill.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Token used to report errors raised while evaluating this node. */
        Token position();
    }

    public interface ExprVisitor<R> {
        R visitNumberExpr(NumberLiteral expr);
        R visitStringExpr(StringLiteral expr);
        R visitBooleanExpr(BooleanLiteral expr);
        R visitIdentifierExpr(Identifier expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
    }

    // -------------------------
    // Literals
    // -------------------------

    public static final class NumberLiteral implements ExprInterface {
        public final Token token;
        public final double value;

        public NumberLiteral(Token token, double value) {
            this.token = token;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumberExpr(this);
        }

        @Override
        public Token position() { return token; }
    }

    public static final class StringLiteral implements ExprInterface {
        public final Token token;
        public final String value;

        public StringLiteral(Token token, String value) {
            this.token = token;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStringExpr(this);
        }

        @Override
        public Token position() { return token; }
    }

    public static final class BooleanLiteral implements ExprInterface {
        public final Token token;
        public final boolean value;

        public BooleanLiteral(Token token, boolean value) {
            this.token = token;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBooleanExpr(this);
        }

        @Override
        public Token position() { return token; }
    }

    public static final class Identifier implements ExprInterface {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }

        @Override
        public Token position() { return name; }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public Token position() { return operator; }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }

        @Override
        public Token position() { return operator; }
    }

    // -------------------------
    // Calls
    // -------------------------

    /** {@code name(arg, ...)}; only plain names can be called. */
    public static final class Call implements ExprInterface {
        public final Token name;
        public final List<ExprInterface> arguments;

        public Call(Token name, List<ExprInterface> arguments) {
            this.name = name;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public Token position() { return name; }
    }
}
