package com.quill.script.parser;

public enum TokenType {
    // Delimiters
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, COMMA, SEMICOLON,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT, CARET,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    VAR, LET, IF, ELSE, WHILE, FOR, TO, STEP, FUNCTION, RETURN,
    AND, OR, NOT, TRUE, FALSE,

    EOF;

    /** Coarse token classes. */
    public enum Kind { NUMBER, STRING, IDENTIFIER, KEYWORD, OPERATOR, DELIMITER, EOF }

    public Kind kind() {
        switch (this) {
            case LEFT_PAREN: case RIGHT_PAREN: case LEFT_BRACE: case RIGHT_BRACE:
            case COMMA: case SEMICOLON:
                return Kind.DELIMITER;
            case PLUS: case MINUS: case STAR: case SLASH: case PERCENT: case CARET:
            case EQUAL: case EQUAL_EQUAL: case BANG_EQUAL:
            case LESS: case LESS_EQUAL: case GREATER: case GREATER_EQUAL:
                return Kind.OPERATOR;
            case IDENTIFIER: return Kind.IDENTIFIER;
            case STRING: return Kind.STRING;
            case NUMBER: return Kind.NUMBER;
            case EOF: return Kind.EOF;
            default: return Kind.KEYWORD;
        }
    }
}
