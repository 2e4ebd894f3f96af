package com.quill.script;

import com.quill.debug.Debug;
import com.quill.script.parser.ExecutionState;
import com.quill.script.parser.Interpreter;
import com.quill.script.parser.ScriptException;
import com.quill.script.parser.Statement.Block;
import com.quill.script.parser.Value;
import com.quill.surface.DrawingSurface;

/**
 * Interactive session: global variables, user functions and turtle state persist
 * across {@link #evalStatement(String)} calls.
 *
 * A failing input aborts only itself; bindings made by earlier inputs (and by the
 * statements of the failing input that ran before the error) stay. Owned by one
 * thread; {@link #cancel()} may be called from any thread.
 */
public final class Session {
    private static final String TAG = "Session";

    private final DrawingSurface surface;
    private final ExecutionState state;
    private final QuillScript engine;
    private final Interpreter interpreter;

    Session(QuillScript engine, DrawingSurface surface, ExecutionState state) {
        this.engine = engine;
        this.surface = surface;
        this.state = state;
        this.interpreter = engine.newInterpreter(state, surface);
    }

    /**
     * Lexes, parses and runs {@code text} (one or more statements) in the global scope.
     *
     * @return the value of the last expression statement (unit if there is none)
     */
    public RunResult evalStatement(String text) {
        state.clearCancellation();
        Block program;
        try {
            program = engine.parse(text);
        } catch (ScriptException e) {
            Debug.get().d(TAG, "rejected input: " + e.getMessage());
            return RunResult.failed(e);
        }
        try {
            Value out = interpreter.execute(program);
            return RunResult.completed(out);
        } catch (ScriptException e) {
            Debug.get().d(TAG, "statement failed: " + e.getMessage());
            return RunResult.failed(e);
        }
    }

    /** Makes the running evaluation fail with Cancelled at its next loop iteration or call. */
    public void cancel() {
        state.cancel();
    }

    /** Returns the turtle home and clears the surface; variables and functions are kept. */
    public void reset() {
        state.turtle().reset();
        surface.clear();
        surface.resetState();
        surface.moveTo(0, 0);
        surface.setPenDown(true);
    }

    public ExecutionState state() { return state; }

    public DrawingSurface surface() { return surface; }
}
