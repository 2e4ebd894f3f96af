package com.quill.script.parser;

/** Every error a script can produce, grouped by the phase that raises it. */
public enum ErrorKind {
    INVALID_CHARACTER(Phase.LEX, "InvalidCharacter"),
    UNTERMINATED_STRING(Phase.LEX, "UnterminatedString"),
    MALFORMED_NUMBER(Phase.LEX, "MalformedNumber"),

    UNEXPECTED_TOKEN(Phase.PARSE, "UnexpectedToken"),
    MISSING_TOKEN(Phase.PARSE, "MissingToken"),
    INVALID_EXPRESSION(Phase.PARSE, "InvalidExpression"),

    UNDEFINED_VARIABLE(Phase.RUNTIME, "UndefinedVariable"),
    UNDEFINED_FUNCTION(Phase.RUNTIME, "UndefinedFunction"),
    TYPE_ERROR(Phase.RUNTIME, "TypeError"),
    DIVISION_BY_ZERO(Phase.RUNTIME, "DivisionByZero"),
    ARGUMENT_COUNT_MISMATCH(Phase.RUNTIME, "ArgumentCountMismatch"),
    INVALID_ARGUMENT_TYPE(Phase.RUNTIME, "InvalidArgumentType"),
    RECURSION_LIMIT(Phase.RUNTIME, "RecursionLimit"),
    CANCELLED(Phase.RUNTIME, "Cancelled");

    public enum Phase {
        LEX("Lexer"),
        PARSE("Parser"),
        RUNTIME("Runtime");

        public final String label;

        Phase(String label) { this.label = label; }
    }

    public final Phase phase;
    public final String displayName;

    ErrorKind(Phase phase, String displayName) {
        this.phase = phase;
        this.displayName = displayName;
    }
}
