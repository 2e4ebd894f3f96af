package com.quill.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ExecutionState
 *
 * Everything one interpreter session owns:
 *  - globals:   the root scope (outlives every statement)
 *  - functions: the global user-function table (redefinition overwrites)
 *  - callStack: active user-function calls, innermost first
 *  - turtle:    pen position/heading used by the drawing commands
 *
 * A fresh state starts empty; discarding it ends the session. The only member
 * touched from other threads is the cancellation flag.
 */
public class ExecutionState {

    public static final int DEFAULT_MAX_CALL_DEPTH = 200;

    private final Environment globals = new Environment();
    private final Map<String, UserFunction> functions = new LinkedHashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final TurtleState turtle = new TurtleState();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final int maxCallDepth;

    public ExecutionState() {
        this(DEFAULT_MAX_CALL_DEPTH);
    }

    public ExecutionState(int maxCallDepth) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + maxCallDepth);
        this.maxCallDepth = maxCallDepth;
    }

    public Environment globals() { return globals; }
    public TurtleState turtle() { return turtle; }
    public int maxCallDepth() { return maxCallDepth; }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    UserFunction function(String name) {
        return functions.get(name);
    }

    void defineFunction(UserFunction fn) {
        functions.put(fn.name, fn);
    }

    Deque<CallFrame> callStack() {
        return callStack;
    }

    /** Active calls, innermost first. */
    public List<CallFrame> callStackSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(callStack));
    }

    /** Requests the running evaluation to stop at its next loop iteration or call. */
    public void cancel() {
        cancelled.set(true);
    }

    public void clearCancellation() {
        cancelled.set(false);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
