package com.quill.script.parser;

/**
 * Outcome of executing one statement: either fall through to the next statement
 * or unwind to the enclosing function call carrying the returned value.
 */
public final class ExecSignal {

    public static final ExecSignal NORMAL = new ExecSignal(false, null);

    private final boolean returned;
    private final Value value;

    private ExecSignal(boolean returned, Value value) {
        this.returned = returned;
        this.value = value;
    }

    public static ExecSignal returned(Value value) {
        return new ExecSignal(true, value == null ? Value.unit() : value);
    }

    public boolean isReturn() { return returned; }

    /** The returned value; only meaningful when {@link #isReturn()}. */
    public Value value() {
        if (!returned) throw new IllegalStateException("Not a return signal");
        return value;
    }
}
