package com.quill.surface;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * DrawingSurface that keeps every primitive call in order.
 *
 * Used by the command line hosts (the recording is exported as JSON for an external
 * renderer) and by tests. {@link #clear()} is recorded and also drops everything
 * recorded before it, matching what a canvas would show.
 *
 * JSON shape:
 * <pre>
 * { "presented": 1,
 *   "operations": [ {"op":"lineTo","x":0.0,"y":100.0}, ... ] }
 * </pre>
 */
public class RecordingSurface implements DrawingSurface {

    private static final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final List<DrawOp> ops = new ArrayList<>();
    private int presentCount;

    public List<DrawOp> operations() {
        return Collections.unmodifiableList(ops);
    }

    /** Operations named {@code op}, in call order. */
    public List<DrawOp> operations(String op) {
        List<DrawOp> out = new ArrayList<>();
        for (DrawOp o : ops) {
            if (o.op.equals(op)) out.add(o);
        }
        return out;
    }

    public int presentCount() {
        return presentCount;
    }

    @Override
    public void moveTo(double x, double y) {
        record("moveTo", "x", x, "y", y);
    }

    @Override
    public void lineTo(double x, double y) {
        record("lineTo", "x", x, "y", y);
    }

    @Override
    public void setPenDown(boolean down) {
        record("setPenDown", "down", down);
    }

    @Override
    public void setColor(String color) {
        if (color == null) throw new IllegalArgumentException("color must not be null");
        record("setColor", "color", color);
    }

    @Override
    public void setWidth(double width) {
        record("setWidth", "width", width);
    }

    @Override
    public void setFill(boolean fill) {
        record("setFill", "fill", fill);
    }

    @Override
    public void drawCircle(double radius, double centerX, double centerY) {
        record("drawCircle", "radius", radius, "centerX", centerX, "centerY", centerY);
    }

    @Override
    public void drawRectangle(double width, double height, double x, double y) {
        record("drawRectangle", "width", width, "height", height, "x", x, "y", y);
    }

    @Override
    public void drawLine(double x1, double y1, double x2, double y2) {
        record("drawLine", "x1", x1, "y1", y1, "x2", x2, "y2", y2);
    }

    @Override
    public void drawPolygon(List<Point> points) {
        if (points == null || points.size() < 3) {
            throw new IllegalArgumentException("polygon needs at least 3 points");
        }
        record("drawPolygon", "points", List.copyOf(points));
    }

    @Override
    public void drawArc(double width, double height, double angleDegrees, double centerX, double centerY) {
        record("drawArc", "width", width, "height", height, "angle", angleDegrees,
                "centerX", centerX, "centerY", centerY);
    }

    @Override
    public void clear() {
        ops.clear();
        record("clear");
    }

    @Override
    public void resetState() {
        record("resetState");
    }

    @Override
    public void present() {
        presentCount++;
    }

    public ObjectNode toJsonTree() {
        ObjectNode root = om.createObjectNode();
        root.put("presented", presentCount);
        ArrayNode arr = root.putArray("operations");
        for (DrawOp op : ops) {
            ObjectNode n = arr.addObject();
            n.put("op", op.op);
            for (Map.Entry<String, Object> e : op.args.entrySet()) {
                Object v = e.getValue();
                if (v instanceof Double) n.put(e.getKey(), (Double) v);
                else if (v instanceof Boolean) n.put(e.getKey(), (Boolean) v);
                else if (v instanceof String) n.put(e.getKey(), (String) v);
                else if (v instanceof List<?>) {
                    ArrayNode pts = n.putArray(e.getKey());
                    for (Object p : (List<?>) v) {
                        Point pt = (Point) p;
                        pts.addArray().add(pt.x).add(pt.y);
                    }
                } else {
                    throw new IllegalStateException("Unsupported draw argument: " + v);
                }
            }
        }
        return root;
    }

    public String toJson() {
        try {
            return om.writeValueAsString(toJsonTree());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize drawing", e);
        }
    }

    private void record(String op, Object... kv) {
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            args.put((String) kv[i], kv[i + 1]);
        }
        ops.add(new DrawOp(op, args));
    }
}
