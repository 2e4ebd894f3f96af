package com.quill.script.plugins;

import java.util.List;
import java.util.Random;

import com.quill.script.QuillScript;
import com.quill.script.parser.ErrorKind;
import com.quill.script.parser.ScriptRuntimeException;
import com.quill.script.parser.Value;

/**
 * QuillMathPlugin
 *
 * Math built-ins. Angles are in degrees throughout, matching the drawing commands:
 *   sin(30)      // 0.5
 *   atan2(1, 1)  // 45
 *
 * Every argument must be a number and the argument count is exact.
 *
 * Usage:
 *   QuillMathPlugin.register(engine, random);
 */
public final class QuillMathPlugin {

    private QuillMathPlugin() {}

    public static void register(QuillScript engine, Random random) {

        engine.registerFunction("sin", args -> {
            requireArgs("sin", args, 1);
            return Value.number(Math.sin(Math.toRadians(num("sin", args, 0))));
        });

        engine.registerFunction("cos", args -> {
            requireArgs("cos", args, 1);
            return Value.number(Math.cos(Math.toRadians(num("cos", args, 0))));
        });

        engine.registerFunction("tan", args -> {
            requireArgs("tan", args, 1);
            return Value.number(Math.tan(Math.toRadians(num("tan", args, 0))));
        });

        engine.registerFunction("asin", args -> {
            requireArgs("asin", args, 1);
            return Value.number(Math.toDegrees(Math.asin(unitRange("asin", num("asin", args, 0)))));
        });

        engine.registerFunction("acos", args -> {
            requireArgs("acos", args, 1);
            return Value.number(Math.toDegrees(Math.acos(unitRange("acos", num("acos", args, 0)))));
        });

        engine.registerFunction("atan", args -> {
            requireArgs("atan", args, 1);
            return Value.number(Math.toDegrees(Math.atan(num("atan", args, 0))));
        });

        engine.registerFunction("atan2", args -> {
            requireArgs("atan2", args, 2);
            return Value.number(Math.toDegrees(Math.atan2(num("atan2", args, 0), num("atan2", args, 1))));
        });

        engine.registerFunction("sqrt", args -> {
            requireArgs("sqrt", args, 1);
            double v = num("sqrt", args, 0);
            if (v < 0) {
                throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                        "sqrt() of a negative number: " + Value.formatNumber(v));
            }
            return Value.number(Math.sqrt(v));
        });

        engine.registerFunction("abs", args -> {
            requireArgs("abs", args, 1);
            return Value.number(Math.abs(num("abs", args, 0)));
        });

        engine.registerFunction("floor", args -> {
            requireArgs("floor", args, 1);
            return Value.number(Math.floor(num("floor", args, 0)));
        });

        engine.registerFunction("ceil", args -> {
            requireArgs("ceil", args, 1);
            return Value.number(Math.ceil(num("ceil", args, 0)));
        });

        engine.registerFunction("round", args -> {
            // half up: round(2.5) == 3, round(-2.5) == -2
            requireArgs("round", args, 1);
            return Value.number(Math.floor(num("round", args, 0) + 0.5));
        });

        engine.registerFunction("min", args -> {
            requireArgs("min", args, 2);
            return Value.number(Math.min(num("min", args, 0), num("min", args, 1)));
        });

        engine.registerFunction("max", args -> {
            requireArgs("max", args, 2);
            return Value.number(Math.max(num("max", args, 0), num("max", args, 1)));
        });

        engine.registerFunction("pow", args -> {
            requireArgs("pow", args, 2);
            return Value.number(Math.pow(num("pow", args, 0), num("pow", args, 1)));
        });

        engine.registerFunction("exp", args -> {
            requireArgs("exp", args, 1);
            return Value.number(Math.exp(num("exp", args, 0)));
        });

        engine.registerFunction("log", args -> {
            requireArgs("log", args, 1);
            double v = num("log", args, 0);
            if (v <= 0) {
                throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                        "log() needs a positive number, got " + Value.formatNumber(v));
            }
            return Value.number(Math.log(v));
        });

        engine.registerFunction("clamp", args -> {
            requireArgs("clamp", args, 3);
            double v = num("clamp", args, 0);
            double lo = num("clamp", args, 1);
            double hi = num("clamp", args, 2);
            return Value.number(Math.max(lo, Math.min(hi, v)));
        });

        engine.registerFunction("random", args -> {
            requireArgs("random", args, 0);
            return Value.number(random.nextDouble());
        });

        engine.registerFunction("pi", args -> {
            requireArgs("pi", args, 0);
            return Value.number(Math.PI);
        });

        engine.registerFunction("e", args -> {
            requireArgs("e", args, 0);
            return Value.number(Math.E);
        });
    }

    private static double unitRange(String fn, double v) {
        if (v < -1.0 || v > 1.0) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                    fn + "() needs a value between -1 and 1, got " + Value.formatNumber(v));
        }
        return v;
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new ScriptRuntimeException(ErrorKind.ARGUMENT_COUNT_MISMATCH,
                    fn + "() expects " + n + " argument(s), got " + args.size());
        }
    }

    private static double num(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.NUMBER) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                    fn + "() argument " + (idx + 1) + " must be a number, got " + v.typeName());
        }
        return v.asNumber();
    }
}
