package com.quill.script.parser;

public final class ParseException extends ScriptException {
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    ParseException(ErrorKind kind, Token at, String expected) {
        super(kind, at.line, at.column, "Expected " + expected + " but found " + describe(at));
        this.expected = expected;
        this.found = describe(at);
    }

    public String expected() { return expected; }
    public String found() { return found; }

    static String describe(Token t) {
        if (t.type == TokenType.EOF) return "end of input";
        return "'" + t.lexeme + "'";
    }
}
