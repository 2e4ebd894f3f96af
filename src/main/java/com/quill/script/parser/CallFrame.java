package com.quill.script.parser;

public class CallFrame {
    public final String functionName;
    public final int line;

    CallFrame(String functionName, int line) {
        this.functionName = functionName;
        this.line = line;
    }

    @Override
    public String toString() {
        return functionName + "() called at line " + line;
    }
}
