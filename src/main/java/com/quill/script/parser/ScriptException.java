package com.quill.script.parser;

/**
 * Base of all language-level errors (lexing, parsing, execution).
 *
 * Carries the error kind and the 1-based source position of the offending token
 * or node. Line 0 means "position not known yet" and is filled in by the
 * interpreter at the nearest call site.
 */
public abstract class ScriptException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final int line;
    private final int column;
    private final String detail;

    protected ScriptException(ErrorKind kind, int line, int column, String detail) {
        super(format(kind, line, column, detail));
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public ErrorKind kind() { return kind; }
    public int line() { return line; }
    public int column() { return column; }

    /** The human-readable message without position prefix. */
    public String detail() { return detail; }

    public boolean hasPosition() { return line > 0; }

    /** One-line report used by the command line hosts. */
    public String report() {
        return kind.phase.label + " error at line " + line + ", column " + column + ": " + detail;
    }

    private static String format(ErrorKind kind, int line, int column, String detail) {
        return kind.displayName + " at " + line + ":" + column + ": " + detail;
    }
}
