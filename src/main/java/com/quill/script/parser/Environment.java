package com.quill.script.parser;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope: name to value bindings plus a lookup-only link to the
 * enclosing scope. The root (global) scope has no parent.
 */
public class Environment {

    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    /** Declaration always binds in this scope, replacing an existing binding here. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public boolean exists(String name) {
        return lookup(name) != null;
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    /** Walks outward; returns null when no scope binds the name. */
    public Value lookup(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /**
     * Rebinds the name in the nearest scope that defines it.
     *
     * @return false when no scope defines the name (nothing is written)
     */
    public boolean assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return true;
            }
        }
        return false;
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }
}
