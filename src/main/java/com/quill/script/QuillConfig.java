package com.quill.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quill.debug.DebugLevel;
import com.quill.script.parser.ExecutionState;

/**
 * Engine and host settings, read from a JSON object. Every key is optional:
 *
 * <pre>
 * {
 *   "maxCallDepth": 200,
 *   "randomSeed": 42,
 *   "debugLevel": "WARN",
 *   "outputPath": "drawing.json",
 *   "timeoutMs": 0
 * }
 * </pre>
 *
 * Unknown keys and wrongly typed values are rejected with IllegalArgumentException.
 * Instances are immutable; the with* methods return modified copies.
 */
public final class QuillConfig {

    private static final ObjectMapper om = new ObjectMapper();

    private final int maxCallDepth;
    private final Long randomSeed;
    private final DebugLevel debugLevel;
    private final String outputPath;
    private final long timeoutMs;

    private QuillConfig(int maxCallDepth, Long randomSeed, DebugLevel debugLevel, String outputPath, long timeoutMs) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1, got " + maxCallDepth);
        if (timeoutMs < 0) throw new IllegalArgumentException("timeoutMs must be >= 0, got " + timeoutMs);
        this.maxCallDepth = maxCallDepth;
        this.randomSeed = randomSeed;
        this.debugLevel = debugLevel;
        this.outputPath = outputPath;
        this.timeoutMs = timeoutMs;
    }

    public static QuillConfig defaults() {
        return new QuillConfig(ExecutionState.DEFAULT_MAX_CALL_DEPTH, null, DebugLevel.WARN, null, 0L);
    }

    public static QuillConfig load(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static QuillConfig fromJson(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid config JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config must be a JSON object");
        }

        QuillConfig cfg = defaults();
        int depth = cfg.maxCallDepth;
        Long seed = cfg.randomSeed;
        DebugLevel level = cfg.debugLevel;
        String out = cfg.outputPath;
        long timeout = cfg.timeoutMs;

        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            JsonNode v = e.getValue();
            switch (key) {
                case "maxCallDepth":
                    if (!v.canConvertToInt() || !v.isIntegralNumber()) throw badType(key, "an integer", v);
                    depth = v.intValue();
                    break;
                case "randomSeed":
                    if (v.isNull()) {
                        seed = null;
                    } else {
                        if (!v.isIntegralNumber() || !v.canConvertToLong()) throw badType(key, "an integer", v);
                        seed = v.longValue();
                    }
                    break;
                case "debugLevel":
                    if (!v.isTextual()) throw badType(key, "a level name", v);
                    try {
                        level = DebugLevel.valueOf(v.asText().trim().toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException ex) {
                        throw new IllegalArgumentException("Unknown debugLevel: " + v.asText(), ex);
                    }
                    break;
                case "outputPath":
                    if (v.isNull()) out = null;
                    else if (v.isTextual()) out = v.asText();
                    else throw badType(key, "a string", v);
                    break;
                case "timeoutMs":
                    if (!v.isIntegralNumber() || !v.canConvertToLong()) throw badType(key, "an integer", v);
                    timeout = v.longValue();
                    break;
                default:
                    throw new IllegalArgumentException("Unknown config key: " + key);
            }
        }
        return new QuillConfig(depth, seed, level, out, timeout);
    }

    private static IllegalArgumentException badType(String key, String expected, JsonNode got) {
        return new IllegalArgumentException("Config key '" + key + "' must be " + expected + ", got " + got);
    }

    public int maxCallDepth() { return maxCallDepth; }

    /** Null when the generator should be seeded from the clock. */
    public Long randomSeed() { return randomSeed; }

    public DebugLevel debugLevel() { return debugLevel; }

    /** Null means standard output. */
    public String outputPath() { return outputPath; }

    /** 0 means no timeout. */
    public long timeoutMs() { return timeoutMs; }

    public QuillConfig withMaxCallDepth(int depth) {
        return new QuillConfig(depth, randomSeed, debugLevel, outputPath, timeoutMs);
    }

    public QuillConfig withRandomSeed(Long seed) {
        return new QuillConfig(maxCallDepth, seed, debugLevel, outputPath, timeoutMs);
    }

    public QuillConfig withDebugLevel(DebugLevel level) {
        return new QuillConfig(maxCallDepth, randomSeed, level == null ? DebugLevel.WARN : level, outputPath, timeoutMs);
    }

    public QuillConfig withOutputPath(String path) {
        return new QuillConfig(maxCallDepth, randomSeed, debugLevel, path, timeoutMs);
    }

    public QuillConfig withTimeoutMs(long ms) {
        return new QuillConfig(maxCallDepth, randomSeed, debugLevel, outputPath, ms);
    }

    @Override
    public String toString() {
        return "QuillConfig{maxCallDepth=" + maxCallDepth
                + ", randomSeed=" + randomSeed
                + ", debugLevel=" + debugLevel
                + ", outputPath=" + outputPath
                + ", timeoutMs=" + timeoutMs + "}";
    }
}
