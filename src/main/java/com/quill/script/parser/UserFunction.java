package com.quill.script.parser;

import java.util.List;

import com.quill.script.parser.Statement.Block;

public class UserFunction {
    final String name;
    final List<Token> params;
    final Block body;
    final Environment closure;

    UserFunction(String name, List<Token> params, Block body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    public String name() { return name; }

    public int arity() { return params.size(); }

    /** Arity was checked by the caller. */
    Value call(Interpreter interpreter, List<Value> args) {
        // The call scope hangs off the closure (the global scope), never off the caller.
        Environment scope = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            scope.define(params.get(i).lexeme, args.get(i));
        }

        ExecSignal signal = interpreter.executeIn(body.statements, scope);
        return signal.isReturn() ? signal.value() : Value.unit();
    }
}
