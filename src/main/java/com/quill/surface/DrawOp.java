package com.quill.surface;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One primitive call received by a {@link RecordingSurface}.
 *
 * Arguments keep their call order; values are Double, Boolean, String or a
 * List of Point (polygon).
 */
public final class DrawOp {
    public final String op;
    public final Map<String, Object> args;

    DrawOp(String op, Map<String, Object> args) {
        this.op = op;
        this.args = Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public double num(String key) {
        Object v = args.get(key);
        if (!(v instanceof Double)) throw new IllegalStateException(op + " has no numeric argument '" + key + "'");
        return (Double) v;
    }

    @Override
    public String toString() {
        return op + args;
    }
}
