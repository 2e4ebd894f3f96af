package com.quill.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitVarStmt(VarStmt stmt);
        R visitAssignStmt(AssignStmt stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitForRangeStmt(ForRange stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** {@code var name [= init]} or {@code let name [= init]}; initializer may be null. */
    public static final class VarStmt implements Stmt {
        public final Token keyword;
        public final Token name;
        public final Expr.ExprInterface initializer;
        VarStmt(Token keyword, Token name, Expr.ExprInterface initializer) {
            this.keyword = keyword;
            this.name = name;
            this.initializer = initializer;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarStmt(this); }
    }

    public static final class AssignStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;
        AssignStmt(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class Block implements Stmt {
        public final Token brace;   // null for the program block
        public final List<Stmt> statements;
        Block(Token brace, List<Stmt> statements) {
            this.brace = brace;
            this.statements = statements;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    /** {@code else if} chains are stored as an else block holding a single If. */
    public static final class If implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Block elseBranch;
        If(Token keyword, Expr.ExprInterface condition, Block thenBranch, Block elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final Block body;
        While(Token keyword, Expr.ExprInterface condition, Block body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    /** {@code for var = from to to [step step] { body }}; step may be null (1). */
    public static final class ForRange implements Stmt {
        public final Token keyword;
        public final Token variable;
        public final Expr.ExprInterface from;
        public final Expr.ExprInterface to;
        public final Expr.ExprInterface step;
        public final Block body;
        ForRange(Token keyword, Token variable, Expr.ExprInterface from, Expr.ExprInterface to,
                 Expr.ExprInterface step, Block body) {
            this.keyword = keyword;
            this.variable = variable;
            this.from = from;
            this.to = to;
            this.step = step;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForRangeStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final Block body;

        FunctionStmt(Token name, List<Token> params, Block body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }
}
