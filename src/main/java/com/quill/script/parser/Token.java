package com.quill.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    public final int column;

    /** True when an unescaped line break separates this token from the previous one. */
    public final boolean newlineBefore;

    Token(TokenType type, String lexeme, Object literal, int line, int column, boolean newlineBefore) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.newlineBefore = newlineBefore;
    }

    public TokenType.Kind kind() {
        return type.kind();
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' " + line + ":" + column;
    }
}
