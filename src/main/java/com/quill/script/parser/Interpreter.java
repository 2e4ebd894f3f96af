package com.quill.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.quill.debug.Debug;
import com.quill.script.QuillScript.BuiltinFunction;
import com.quill.script.parser.Expr.Binary;
import com.quill.script.parser.Expr.BooleanLiteral;
import com.quill.script.parser.Expr.Call;
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
 * Tree-walking interpreter.
 *
 * Statements yield an {@link ExecSignal}; a return unwinds through nested blocks
 * as a value, not as an exception. Language errors are thrown as
 * {@link ScriptRuntimeException} with the position of the failing node; the
 * engine facade turns them into results.
 *
 * Call resolution order: drawing commands, then math/utility built-ins, then
 * user functions.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<ExecSignal> {
    private static final String TAG = "Interpreter";

    Environment env;
    private final ExecutionState state;
    private final Map<String, BuiltinFunction> drawingCommands;
    private final Map<String, BuiltinFunction> functions;

    public Interpreter(ExecutionState state, Map<String, BuiltinFunction> drawingCommands,
                       Map<String, BuiltinFunction> functions) {
        this.state = state;
        this.env = state.globals();
        this.drawingCommands = drawingCommands;
        this.functions = functions;
    }

    /**
     * Runs a program in the global scope.
     *
     * @return the value of a top-level return, else the value of the last statement
     *         when it was an expression statement, else unit
     */
    public Value execute(Block program) {
        try {
            Value last = Value.unit();
            for (Stmt stmt : program.statements) {
                if (stmt instanceof ExprStmt) {
                    last = eval(((ExprStmt) stmt).expression);
                    continue;
                }
                ExecSignal signal = stmt.accept(this);
                if (signal.isReturn()) return signal.value();
                last = Value.unit();
            }
            return last;
        } catch (StackOverflowError e) {
            throw stackExhausted(0, 0);
        } finally {
            // top level: nothing may stay on the call stack, even after an overflow
            state.callStack().clear();
            env = state.globals();
        }
    }

    /** Runs one statement in the current scope; expression statements yield their value. */
    public Value executeStatement(Stmt stmt) {
        try {
            if (stmt instanceof ExprStmt) {
                return eval(((ExprStmt) stmt).expression);
            }
            ExecSignal signal = stmt.accept(this);
            return signal.isReturn() ? signal.value() : Value.unit();
        } catch (StackOverflowError e) {
            throw stackExhausted(0, 0);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public ExecSignal visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
        return ExecSignal.NORMAL;
    }

    @Override
    public ExecSignal visitVarStmt(VarStmt stmt) {
        Value value = (stmt.initializer == null) ? Value.unit() : eval(stmt.initializer);
        env.define(stmt.name.lexeme, value);
        return ExecSignal.NORMAL;
    }

    @Override
    public ExecSignal visitAssignStmt(AssignStmt stmt) {
        Value value = eval(stmt.value);
        if (!env.assign(stmt.name.lexeme, value)) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_VARIABLE, stmt.name,
                    "Cannot assign to undeclared variable '" + stmt.name.lexeme + "' (declare it with var or let)");
        }
        return ExecSignal.NORMAL;
    }

    @Override
    public ExecSignal visitBlockStmt(Block stmt) {
        return executeIn(stmt.statements, env.childScope());
    }

    /** Executes statements with {@code scope} as the current scope, restoring the previous one after. */
    ExecSignal executeIn(List<Stmt> statements, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : statements) {
                ExecSignal signal = s.accept(this);
                if (signal.isReturn()) return signal;
            }
            return ExecSignal.NORMAL;
        } finally {
            env = previous;
        }
    }

    @Override
    public ExecSignal visitIfStmt(If stmt) {
        if (truth(eval(stmt.condition), stmt.condition.position(), "if condition")) {
            return stmt.thenBranch.accept(this);
        }
        if (stmt.elseBranch != null) {
            return stmt.elseBranch.accept(this);
        }
        return ExecSignal.NORMAL;
    }

    @Override
    public ExecSignal visitWhileStmt(While stmt) {
        while (truth(eval(stmt.condition), stmt.condition.position(), "while condition")) {
            checkCancelled(stmt.keyword);
            ExecSignal signal = stmt.body.accept(this);
            if (signal.isReturn()) return signal;
        }
        return ExecSignal.NORMAL;
    }

    @Override
    public ExecSignal visitForRangeStmt(ForRange stmt) {
        double from = rangeBound(stmt.from, "start");
        double to = rangeBound(stmt.to, "end");
        double step = (stmt.step == null) ? 1.0 : rangeBound(stmt.step, "step");

        // i is recomputed from the iteration count so fractional steps do not drift
        long k = 0;
        double i = from;
        while ((step > 0 && i <= to) || (step < 0 && i >= to)) {
            checkCancelled(stmt.keyword);
            Environment iteration = env.childScope();
            iteration.define(stmt.variable.lexeme, Value.number(i));
            ExecSignal signal = executeIn(stmt.body.statements, iteration);
            if (signal.isReturn()) return signal;
            k++;
            i = from + k * step;
        }
        return ExecSignal.NORMAL;
    }

    private double rangeBound(Expr.ExprInterface expr, String what) {
        Value v = eval(expr);
        if (v.getType() != Value.Type.NUMBER) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, expr.position(),
                    "for-range " + what + " must be a number, got " + v.typeName());
        }
        return v.asNumber();
    }

    @Override
    public ExecSignal visitFunctionStmt(FunctionStmt stmt) {
        String name = stmt.name.lexeme;
        if (drawingCommands.containsKey(name) || functions.containsKey(name)) {
            Debug.get().w(TAG, "function " + name + "() at line " + stmt.name.line
                    + " is shadowed by the built-in of the same name and will never be called");
        }
        if (state.hasFunction(name)) {
            Debug.get().d(TAG, "redefining function " + name + "()");
        }
        state.defineFunction(new UserFunction(name, stmt.params, stmt.body, state.globals()));
        return ExecSignal.NORMAL;
    }

    @Override
    public ExecSignal visitReturnStmt(ReturnStmt stmt) {
        return ExecSignal.returned(stmt.value == null ? Value.unit() : eval(stmt.value));
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value eval(Expr.ExprInterface expr) { return expr.accept(this); }

    @Override
    public Value visitNumberExpr(NumberLiteral expr) {
        return Value.number(expr.value);
    }

    @Override
    public Value visitStringExpr(StringLiteral expr) {
        return Value.string(expr.value);
    }

    @Override
    public Value visitBooleanExpr(BooleanLiteral expr) {
        return Value.bool(expr.value);
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        Value v = env.lookup(expr.name.lexeme);
        if (v == null) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_VARIABLE, expr.name,
                    "Undefined variable: " + expr.name.lexeme);
        }
        return v;
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case NOT:
                return Value.bool(!truth(right, expr.operator, "operand of 'not'"));
            case MINUS:
                if (right.getType() != Value.Type.NUMBER) {
                    throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, expr.operator,
                            "Unary '-' expects a number, got " + right.typeName());
                }
                return Value.number(-right.asNumber());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Token op = expr.operator;

        // and/or never evaluate the right side once the result is known
        if (op.type == TokenType.AND) {
            if (!truth(eval(expr.left), expr.left.position(), "left operand of 'and'")) return Value.bool(false);
            return Value.bool(truth(eval(expr.right), expr.right.position(), "right operand of 'and'"));
        }
        if (op.type == TokenType.OR) {
            if (truth(eval(expr.left), expr.left.position(), "left operand of 'or'")) return Value.bool(true);
            return Value.bool(truth(eval(expr.right), expr.right.position(), "right operand of 'or'"));
        }

        Value left = eval(expr.left);
        Value right = eval(expr.right);

        switch (op.type) {
            case PLUS:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() + right.asNumber());
            case MINUS:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() - right.asNumber());
            case STAR:
                requireNumbers(left, right, op);
                return Value.number(left.asNumber() * right.asNumber());
            case SLASH:
                requireNumbers(left, right, op);
                if (right.asNumber() == 0.0) {
                    throw new ScriptRuntimeException(ErrorKind.DIVISION_BY_ZERO, op, "Division by zero");
                }
                return Value.number(left.asNumber() / right.asNumber());
            case PERCENT:
                requireNumbers(left, right, op);
                if (right.asNumber() == 0.0) {
                    throw new ScriptRuntimeException(ErrorKind.DIVISION_BY_ZERO, op, "Modulo by zero");
                }
                return Value.number(left.asNumber() % right.asNumber());
            case CARET:
                requireNumbers(left, right, op);
                return Value.number(Math.pow(left.asNumber(), right.asNumber()));

            case GREATER:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() >= right.asNumber());
            case LESS:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(left, right, op);
                return Value.bool(left.asNumber() <= right.asNumber());

            case EQUAL_EQUAL:
                requireSameType(left, right, op);
                return Value.bool(left.sameAs(right));
            case BANG_EQUAL:
                requireSameType(left, right, op);
                return Value.bool(!left.sameAs(right));

            default:
                throw new IllegalStateException("Unsupported binary operator: " + op.type);
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        String name = expr.name.lexeme;

        BuiltinFunction builtin = drawingCommands.get(name);
        if (builtin == null) builtin = functions.get(name);
        if (builtin != null) {
            List<Value> args = evalArgs(expr.arguments);
            try {
                Value out = builtin.call(args);
                if (out == null) throw new IllegalStateException("Built-in " + name + "() returned null");
                return out;
            } catch (ScriptRuntimeException e) {
                throw e.withPosition(expr.name);
            }
        }

        UserFunction fn = state.function(name);
        if (fn == null) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_FUNCTION, expr.name, "Undefined function: " + name);
        }
        if (expr.arguments.size() != fn.arity()) {
            throw new ScriptRuntimeException(ErrorKind.ARGUMENT_COUNT_MISMATCH, expr.name,
                    name + "() expects " + fn.arity() + " argument(s), got " + expr.arguments.size());
        }
        List<Value> args = evalArgs(expr.arguments);

        checkCancelled(expr.name);
        if (state.callStack().size() >= state.maxCallDepth()) {
            throw new ScriptRuntimeException(ErrorKind.RECURSION_LIMIT, expr.name,
                    "Maximum call depth of " + state.maxCallDepth() + " exceeded calling " + name + "()");
        }

        state.callStack().push(new CallFrame(name, expr.name.line));
        try {
            return fn.call(this, args);
        } catch (StackOverflowError e) {
            throw stackExhausted(expr.name.line, expr.name.column);
        } finally {
            state.callStack().pop();
        }
    }

    // The Java stack ran out before maxCallDepth was reached.
    private ScriptRuntimeException stackExhausted(int line, int column) {
        Debug.get().w(TAG, "java stack exhausted at call depth " + state.callStack().size()
                + ", innermost: " + state.callStack().peek());
        return new ScriptRuntimeException(ErrorKind.RECURSION_LIMIT, line, column,
                "Call nesting exhausted the stack below the configured depth of " + state.maxCallDepth());
    }

    private List<Value> evalArgs(List<Expr.ExprInterface> arguments) {
        List<Value> args = new ArrayList<Value>(arguments.size());
        for (Expr.ExprInterface a : arguments) args.add(eval(a));
        return args;
    }

    // -------------------------
    // Helpers
    // -------------------------

    /** Conditions accept bools and numbers (non-zero is true); anything else is a type error. */
    public boolean truth(Value v, Token at, String context) {
        switch (v.getType()) {
            case BOOL: return v.asBool();
            case NUMBER: return v.asNumber() != 0.0;
            case STRING:
            case UNIT:
                throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, at,
                        context + " must be a bool or number, got " + v.typeName());
            default:
                throw new IllegalStateException("Unknown value type: " + v.getType());
        }
    }

    private void requireNumbers(Value a, Value b, Token op) {
        if (a.getType() != Value.Type.NUMBER || b.getType() != Value.Type.NUMBER) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, op,
                    "Operator '" + op.lexeme + "' expects numbers, got " + a.typeName() + " and " + b.typeName());
        }
    }

    private void requireSameType(Value a, Value b, Token op) {
        if (a.getType() != b.getType()) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, op,
                    "Cannot compare " + a.typeName() + " with " + b.typeName() + " using '" + op.lexeme + "'");
        }
    }

    private void checkCancelled(Token at) {
        if (state.isCancelled()) {
            throw new ScriptRuntimeException(ErrorKind.CANCELLED, at, "Execution cancelled by host");
        }
    }
}
