package com.quill.script.parser;

public final class LexException extends ScriptException {
    private static final long serialVersionUID = 1L;

    LexException(ErrorKind kind, int line, int column, String detail) {
        super(kind, line, column, detail);
    }
}
