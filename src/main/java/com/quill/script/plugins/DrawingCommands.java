package com.quill.script.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.quill.debug.Debug;
import com.quill.script.QuillScript.BuiltinFunction;
import com.quill.script.parser.ErrorKind;
import com.quill.script.parser.ScriptRuntimeException;
import com.quill.script.parser.TurtleState;
import com.quill.script.parser.Value;
import com.quill.surface.DrawingSurface;
import com.quill.surface.Point;

/**
 * DrawingCommands
 *
 * Binds the language's drawing commands to one surface and one turtle.
 * Relative commands are resolved against the turtle, so the surface only ever
 * receives absolute coordinates:
 *
 *   forward(100)     // lineTo(0, 100) from home, pen down
 *   right(90)
 *   circle(20)       // drawCircle(20, <turtle x>, <turtle y>)
 *
 * Commands return unit; the queries xpos(), ypos() and heading() read the turtle.
 */
public final class DrawingCommands {
    private static final String TAG = "Drawing";

    /** Every name bound by {@link #bind}, aliases included. */
    public static final Set<String> NAMES;

    static {
        NAMES = Collections.unmodifiableSet(
                bind(new NullSurface(), new TurtleState()).keySet());
    }

    private DrawingCommands() {}

    public static Map<String, BuiltinFunction> bind(DrawingSurface surface, TurtleState turtle) {
        Map<String, BuiltinFunction> m = new LinkedHashMap<>();

        // ---- movement ----

        BuiltinFunction forward = args -> {
            requireArgs("forward", args, 1);
            double[] to = turtle.ahead(num("forward", args, 0));
            travel(surface, turtle, to[0], to[1]);
            return Value.unit();
        };
        m.put("forward", forward);
        m.put("fd", forward);

        BuiltinFunction backward = args -> {
            requireArgs("backward", args, 1);
            double[] to = turtle.ahead(-num("backward", args, 0));
            travel(surface, turtle, to[0], to[1]);
            return Value.unit();
        };
        m.put("backward", backward);
        m.put("bk", backward);

        BuiltinFunction left = args -> {
            requireArgs("left", args, 1);
            turtle.turn(num("left", args, 0));
            return Value.unit();
        };
        m.put("left", left);
        m.put("lt", left);

        BuiltinFunction right = args -> {
            requireArgs("right", args, 1);
            turtle.turn(-num("right", args, 0));
            return Value.unit();
        };
        m.put("right", right);
        m.put("rt", right);

        BuiltinFunction setheading = args -> {
            requireArgs("setheading", args, 1);
            turtle.setHeading(num("setheading", args, 0));
            return Value.unit();
        };
        m.put("setheading", setheading);
        m.put("seth", setheading);

        m.put("goto", args -> {
            requireArgs("goto", args, 2);
            travel(surface, turtle, num("goto", args, 0), num("goto", args, 1));
            return Value.unit();
        });

        m.put("home", args -> {
            requireArgs("home", args, 0);
            travel(surface, turtle, 0, 0);
            turtle.setHeading(TurtleState.HOME_HEADING);
            return Value.unit();
        });

        // ---- pen ----

        BuiltinFunction penup = args -> {
            requireArgs("penup", args, 0);
            turtle.setPenDown(false);
            surface.setPenDown(false);
            return Value.unit();
        };
        m.put("penup", penup);
        m.put("pu", penup);

        BuiltinFunction pendown = args -> {
            requireArgs("pendown", args, 0);
            turtle.setPenDown(true);
            surface.setPenDown(true);
            return Value.unit();
        };
        m.put("pendown", pendown);
        m.put("pd", pendown);

        m.put("color", args -> {
            requireArgs("color", args, 1);
            Value v = args.get(0);
            if (v.getType() != Value.Type.STRING) {
                throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                        "color() expects a color name string, got " + v.typeName());
            }
            String name = v.asString().trim();
            if (name.isEmpty()) {
                throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE, "color() name must not be empty");
            }
            surface.setColor(name);
            return Value.unit();
        });

        m.put("width", args -> {
            requireArgs("width", args, 1);
            double w = num("width", args, 0);
            if (w < 0) {
                throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                        "width() must not be negative, got " + Value.formatNumber(w));
            }
            surface.setWidth(w);
            return Value.unit();
        });

        m.put("fill", args -> {
            requireArgs("fill", args, 0);
            surface.setFill(true);
            return Value.unit();
        });

        m.put("nofill", args -> {
            requireArgs("nofill", args, 0);
            surface.setFill(false);
            return Value.unit();
        });

        // ---- shapes ----

        m.put("circle", args -> {
            requireArgCounts("circle", args, 1, 3);
            double r = num("circle", args, 0);
            if (args.size() == 3) {
                surface.drawCircle(r, num("circle", args, 1), num("circle", args, 2));
            } else {
                surface.drawCircle(r, turtle.x(), turtle.y());
            }
            return Value.unit();
        });

        BuiltinFunction rectangle = args -> {
            requireArgCounts("rectangle", args, 2, 4);
            double w = num("rectangle", args, 0);
            double h = num("rectangle", args, 1);
            if (args.size() == 4) {
                surface.drawRectangle(w, h, num("rectangle", args, 2), num("rectangle", args, 3));
            } else {
                surface.drawRectangle(w, h, turtle.x(), turtle.y());
            }
            return Value.unit();
        };
        m.put("rectangle", rectangle);
        m.put("rect", rectangle);

        m.put("line", args -> {
            requireArgs("line", args, 4);
            surface.drawLine(num("line", args, 0), num("line", args, 1), num("line", args, 2), num("line", args, 3));
            return Value.unit();
        });

        m.put("polygon", args -> {
            if (args.size() < 6 || args.size() % 2 != 0) {
                throw new ScriptRuntimeException(ErrorKind.ARGUMENT_COUNT_MISMATCH,
                        "polygon() expects an even number of coordinates for at least 3 points, got " + args.size());
            }
            List<Point> points = new ArrayList<>(args.size() / 2);
            for (int i = 0; i < args.size(); i += 2) {
                points.add(new Point(num("polygon", args, i), num("polygon", args, i + 1)));
            }
            surface.drawPolygon(points);
            return Value.unit();
        });

        m.put("arc", args -> {
            requireArgCounts("arc", args, 2, 3, 5);
            double w = num("arc", args, 0);
            double h = num("arc", args, 1);
            double angle = (args.size() >= 3) ? num("arc", args, 2) : 0.0;
            if (args.size() == 5) {
                surface.drawArc(w, h, angle, num("arc", args, 3), num("arc", args, 4));
            } else {
                surface.drawArc(w, h, angle, turtle.x(), turtle.y());
            }
            return Value.unit();
        });

        // ---- canvas ----

        m.put("clear", args -> {
            requireArgs("clear", args, 0);
            surface.clear();
            return Value.unit();
        });

        m.put("reset", args -> {
            requireArgs("reset", args, 0);
            turtle.reset();
            surface.resetState();
            surface.moveTo(turtle.x(), turtle.y());
            surface.setPenDown(true);
            return Value.unit();
        });

        m.put("show", args -> {
            requireArgs("show", args, 0);
            surface.present();
            return Value.unit();
        });

        m.put("hide", args -> {
            // the turtle cursor is never drawn
            requireArgs("hide", args, 0);
            Debug.get().t(TAG, "hide() has nothing to hide");
            return Value.unit();
        });

        // ---- queries ----

        m.put("xpos", args -> {
            requireArgs("xpos", args, 0);
            return Value.number(turtle.x());
        });

        m.put("ypos", args -> {
            requireArgs("ypos", args, 0);
            return Value.number(turtle.y());
        });

        m.put("heading", args -> {
            requireArgs("heading", args, 0);
            return Value.number(turtle.heading());
        });

        return Collections.unmodifiableMap(m);
    }

    private static void travel(DrawingSurface surface, TurtleState turtle, double x, double y) {
        if (turtle.isPenDown()) surface.lineTo(x, y);
        else surface.moveTo(x, y);
        turtle.moveTo(x, y);
    }

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new ScriptRuntimeException(ErrorKind.ARGUMENT_COUNT_MISMATCH,
                    fn + "() expects " + n + " argument(s), got " + args.size());
        }
    }

    private static void requireArgCounts(String fn, List<Value> args, int... allowed) {
        for (int n : allowed) {
            if (args.size() == n) return;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < allowed.length; i++) {
            if (i > 0) sb.append(i == allowed.length - 1 ? " or " : ", ");
            sb.append(allowed[i]);
        }
        throw new ScriptRuntimeException(ErrorKind.ARGUMENT_COUNT_MISMATCH,
                fn + "() expects " + sb + " arguments, got " + args.size());
    }

    private static double num(String fn, List<Value> args, int idx) {
        Value v = args.get(idx);
        if (v.getType() != Value.Type.NUMBER) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT_TYPE,
                    fn + "() argument " + (idx + 1) + " must be a number, got " + v.typeName());
        }
        return v.asNumber();
    }

    /** Used only to enumerate the command names. */
    private static final class NullSurface implements DrawingSurface {
        public void moveTo(double x, double y) {}
        public void lineTo(double x, double y) {}
        public void setPenDown(boolean down) {}
        public void setColor(String color) {}
        public void setWidth(double width) {}
        public void setFill(boolean fill) {}
        public void drawCircle(double radius, double centerX, double centerY) {}
        public void drawRectangle(double width, double height, double x, double y) {}
        public void drawLine(double x1, double y1, double x2, double y2) {}
        public void drawPolygon(List<Point> points) {}
        public void drawArc(double width, double height, double angleDegrees, double centerX, double centerY) {}
        public void clear() {}
        public void resetState() {}
        public void present() {}
    }
}
