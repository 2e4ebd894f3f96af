package com.quill.script.parser;

public final class ScriptRuntimeException extends ScriptException {
    private static final long serialVersionUID = 1L;

    public ScriptRuntimeException(ErrorKind kind, int line, int column, String detail) {
        super(kind, line, column, detail);
    }

    /** Error raised where no source position is at hand (built-in functions). */
    public ScriptRuntimeException(ErrorKind kind, String detail) {
        this(kind, 0, 0, detail);
    }

    ScriptRuntimeException(ErrorKind kind, Token at, String detail) {
        this(kind, at.line, at.column, detail);
    }

    ScriptRuntimeException withPosition(Token at) {
        if (hasPosition()) return this;
        return new ScriptRuntimeException(kind(), at.line, at.column, detail());
    }
}
