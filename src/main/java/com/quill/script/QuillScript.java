package com.quill.script;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.quill.debug.Debug;
import com.quill.script.parser.ExecutionState;
import com.quill.script.parser.Interpreter;
import com.quill.script.parser.Lexer;
import com.quill.script.parser.Parser;
import com.quill.script.parser.ScriptException;
import com.quill.script.parser.Statement.Block;
import com.quill.script.parser.Token;
import com.quill.script.parser.Value;
import com.quill.script.plugins.DrawingCommands;
import com.quill.script.plugins.QuillMathPlugin;
import com.quill.surface.DrawingSurface;

/**
 * Core Quill Script engine.
 *
 * - Turtle drawing language (var / let / if / else / while / for-to-step / function / return)
 * - Types: number (double), bool, string, unit
 * - Drawing goes to a host supplied {@link DrawingSurface}; the engine never renders
 * - Function calls resolve to, in order:
 *     - drawing commands (bound to the run's surface and turtle)
 *     - built-ins (math plugin, plus anything registered via registerFunction)
 *     - user functions (function name(a, b) { ...; return ... })
 *
 * Lexer, parser and runtime errors come back as {@link RunResult#failed}; only
 * defects of the embedding (a failing surface, a broken built-in) are thrown.
 */
public class QuillScript {
    private static final String TAG = "QuillScript";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new HashMap<String, BuiltinFunction>();
    private final QuillConfig config;
    private final Random random;

    public QuillScript() {
        this(QuillConfig.defaults());
    }

    public QuillScript(QuillConfig config) {
        this.config = (config == null) ? QuillConfig.defaults() : config;
        this.random = (this.config.randomSeed() == null) ? new Random() : new Random(this.config.randomSeed());
        QuillMathPlugin.register(this, random);
    }

    public QuillConfig config() { return config; }

    /** Registers or replaces a built-in. Drawing command names cannot be overridden this way. */
    public void registerFunction(String name, BuiltinFunction fn) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("function name must not be empty");
        if (fn == null) throw new IllegalArgumentException("function must not be null");
        if (DrawingCommands.NAMES.contains(name)) {
            Debug.get().w(TAG, "built-in " + name + "() is shadowed by the drawing command of the same name");
        }
        functions.put(name, fn);
    }

    public boolean hasFunction(String name) {
        return functions.containsKey(name);
    }

    Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    // ===================== FRONT END =====================

    /** @throws com.quill.script.parser.LexException on the first lexical error */
    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /** @throws com.quill.script.parser.ParseException on the first syntax error */
    public Block parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    public Block parse(String source) {
        return parse(tokenize(source));
    }

    // ===================== EXECUTION =====================

    public RunResult execute(Block program, DrawingSurface surface) {
        return execute(program, surface, newState());
    }

    /**
     * Executes against caller owned state, so another thread can
     * {@link ExecutionState#cancel() cancel} the run.
     */
    public RunResult execute(Block program, DrawingSurface surface, ExecutionState state) {
        Interpreter interpreter = newInterpreter(state, surface);
        try {
            Value out = interpreter.execute(program);
            Debug.get().d(TAG, "run completed: " + out);
            return RunResult.completed(out);
        } catch (ScriptException e) {
            Debug.get().i(TAG, "run failed: " + e.getMessage());
            return RunResult.failed(e);
        }
    }

    public RunResult run(String source, DrawingSurface surface) {
        return run(source, surface, newState());
    }

    public RunResult run(String source, DrawingSurface surface, ExecutionState state) {
        Block program;
        try {
            program = parse(source);
        } catch (ScriptException e) {
            Debug.get().i(TAG, "run failed: " + e.getMessage());
            return RunResult.failed(e);
        }
        return execute(program, surface, state);
    }

    public Session newSession(DrawingSurface surface) {
        return new Session(this, surface, newState());
    }

    public ExecutionState newState() {
        return new ExecutionState(config.maxCallDepth());
    }

    Interpreter newInterpreter(ExecutionState state, DrawingSurface surface) {
        if (surface == null) throw new IllegalArgumentException("surface must not be null");
        return new Interpreter(state, DrawingCommands.bind(surface, state.turtle()), functions());
    }
}
