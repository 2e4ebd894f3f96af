package com.quill.script.parser;

public class Value {
    public enum Type { NUMBER, BOOL, STRING, UNIT }

    private static final Value UNIT = new Value(Type.UNIT, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }
    public static Value unit() { return UNIT; }

    public Type getType() { return type; }

    public boolean isUnit() { return type == Type.UNIT; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + typeName());
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + typeName());
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + typeName());
        return (String) value;
    }

    /** Script-facing type name used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL:   return "bool";
            case STRING: return "string";
            case UNIT:   return "unit";
            default: throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /** Same-typed equality; callers reject mismatched types before asking. */
    public boolean sameAs(Value other) {
        if (type != other.type) throw new IllegalArgumentException("Cannot compare " + typeName() + " with " + other.typeName());
        switch (type) {
            case NUMBER: return asNumber() == other.asNumber();
            case BOOL:   return asBool() == other.asBool();
            case STRING: return asString().equals(other.asString());
            case UNIT:   return true;
            default: throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value v = (Value) o;
        return type == v.type && (type == Type.UNIT || value.equals(v.value));
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + (value == null ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return '"' + asString() + '"';
            case UNIT:
                return "unit";
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /** Integral values print without a fraction: 7 rather than 7.0. */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }
}
