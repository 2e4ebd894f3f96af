package com.quill.script;

import com.quill.script.parser.ScriptException;
import com.quill.script.parser.Value;

/**
 * Outcome of running source text or a parsed program.
 *
 * Exactly one of value / error is set. Lexer, parser and runtime errors all end up
 * here; they are never thrown past the engine facade.
 */
public final class RunResult {

    private final Value value;
    private final ScriptException error;

    private RunResult(Value value, ScriptException error) {
        this.value = value;
        this.error = error;
    }

    public static RunResult completed(Value value) {
        return new RunResult(value == null ? Value.unit() : value, null);
    }

    public static RunResult failed(ScriptException error) {
        if (error == null) throw new IllegalArgumentException("error must not be null");
        return new RunResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** @throws IllegalStateException when the run failed */
    public Value value() {
        if (error != null) throw new IllegalStateException("run failed: " + error.getMessage(), error);
        return value;
    }

    /** The failure, or null when the run completed. */
    public ScriptException error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "completed(" + value + ")" : "failed(" + error.getMessage() + ")";
    }
}
