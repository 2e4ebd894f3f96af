package com.quill.script.parser;

import com.quill.script.parser.Expr.Binary;
import com.quill.script.parser.Expr.BooleanLiteral;
import com.quill.script.parser.Expr.Call;
import com.quill.script.parser.Expr.ExprInterface;
import com.quill.script.parser.Expr.ExprVisitor;
import com.quill.script.parser.Expr.Identifier;
import com.quill.script.parser.Expr.NumberLiteral;
import com.quill.script.parser.Expr.StringLiteral;
import com.quill.script.parser.Expr.Unary;
import com.quill.script.parser.Statement.AssignStmt;
import com.quill.script.parser.Statement.Block;
import com.quill.script.parser.Statement.ExprStmt;
import com.quill.script.parser.Statement.ForRange;
import com.quill.script.parser.Statement.FunctionStmt;
import com.quill.script.parser.Statement.If;
import com.quill.script.parser.Statement.ReturnStmt;
import com.quill.script.parser.Statement.Stmt;
import com.quill.script.parser.Statement.StmtVisitor;
import com.quill.script.parser.Statement.VarStmt;
import com.quill.script.parser.Statement.While;

/**
 * Renders an AST as a canonical S-expression, ignoring source positions.
 * Two trees are structurally equal when their renderings are equal.
 */
public class AstPrinter implements ExprVisitor<String>, StmtVisitor<String> {

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    public String print(Stmt stmt) {
        return stmt.accept(this);
    }

    @Override
    public String visitNumberExpr(NumberLiteral expr) {
        return Value.formatNumber(expr.value);
    }

    @Override
    public String visitStringExpr(StringLiteral expr) {
        return '"' + expr.value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n")
                .replace("\t", "\\t") + '"';
    }

    @Override
    public String visitBooleanExpr(BooleanLiteral expr) {
        return Boolean.toString(expr.value);
    }

    @Override
    public String visitIdentifierExpr(Identifier expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return parenthesize(expr.operator.lexeme, expr.left, expr.right);
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        return parenthesize(expr.operator.lexeme, expr.right);
    }

    @Override
    public String visitCallExpr(Call expr) {
        return parenthesize("call " + expr.name.lexeme, expr.arguments.toArray(new ExprInterface[0]));
    }

    @Override
    public String visitExprStmt(ExprStmt stmt) {
        return parenthesize("expr", stmt.expression);
    }

    @Override
    public String visitVarStmt(VarStmt stmt) {
        if (stmt.initializer == null) return "(var " + stmt.name.lexeme + ")";
        return parenthesize("var " + stmt.name.lexeme, stmt.initializer);
    }

    @Override
    public String visitAssignStmt(AssignStmt stmt) {
        return parenthesize("= " + stmt.name.lexeme, stmt.value);
    }

    @Override
    public String visitBlockStmt(Block stmt) {
        StringBuilder builder = new StringBuilder("(block");
        for (Stmt s : stmt.statements) {
            builder.append(' ').append(s.accept(this));
        }
        return builder.append(')').toString();
    }

    @Override
    public String visitIfStmt(If stmt) {
        StringBuilder builder = new StringBuilder("(if ");
        builder.append(print(stmt.condition)).append(' ').append(visitBlockStmt(stmt.thenBranch));
        if (stmt.elseBranch != null) {
            builder.append(' ').append(visitBlockStmt(stmt.elseBranch));
        }
        return builder.append(')').toString();
    }

    @Override
    public String visitWhileStmt(While stmt) {
        return "(while " + print(stmt.condition) + " " + visitBlockStmt(stmt.body) + ")";
    }

    @Override
    public String visitForRangeStmt(ForRange stmt) {
        return "(for " + stmt.variable.lexeme
                + " " + print(stmt.from)
                + " " + print(stmt.to)
                + " " + (stmt.step == null ? "1" : print(stmt.step))
                + " " + visitBlockStmt(stmt.body) + ")";
    }

    @Override
    public String visitFunctionStmt(FunctionStmt stmt) {
        StringBuilder builder = new StringBuilder("(function ").append(stmt.name.lexeme).append(" (");
        for (int i = 0; i < stmt.params.size(); i++) {
            if (i > 0) builder.append(' ');
            builder.append(stmt.params.get(i).lexeme);
        }
        builder.append(") ").append(visitBlockStmt(stmt.body));
        return builder.append(')').toString();
    }

    @Override
    public String visitReturnStmt(ReturnStmt stmt) {
        if (stmt.value == null) return "(return)";
        return parenthesize("return", stmt.value);
    }

    private String parenthesize(String name, ExprInterface... expressions) {
        StringBuilder builder = new StringBuilder();
        builder.append('(').append(name);
        for (ExprInterface expr : expressions) {
            builder.append(' ').append(expr.accept(this));
        }
        builder.append(')');
        return builder.toString();
    }
}
