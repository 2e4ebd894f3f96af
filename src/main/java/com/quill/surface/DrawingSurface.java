package com.quill.surface;

import java.util.List;

/**
 * Rendering capability consumed by the interpreter.
 *
 * Every call is a side-effecting command; the interpreter never reads state back.
 * Optional arguments of the script-level commands (circle center, rectangle corner,
 * arc angle/center) are resolved by the interpreter from the turtle state before the
 * surface is called, so implementations always receive absolute coordinates.
 *
 * Implementations are called synchronously from the interpreter thread and must not
 * re-enter the interpreter.
 */
public interface DrawingSurface {

    /** Relocates the pen without drawing. */
    void moveTo(double x, double y);

    /** Draws a segment from the current pen location and relocates the pen. */
    void lineTo(double x, double y);

    void setPenDown(boolean down);

    /** Color name ("red") or code ("#ff0000"); interpretation is up to the renderer. */
    void setColor(String color);

    void setWidth(double width);

    void setFill(boolean fill);

    void drawCircle(double radius, double centerX, double centerY);

    void drawRectangle(double width, double height, double x, double y);

    void drawLine(double x1, double y1, double x2, double y2);

    void drawPolygon(List<Point> points);

    void drawArc(double width, double height, double angleDegrees, double centerX, double centerY);

    void clear();

    /** Restores pen color, width and fill defaults. */
    void resetState();

    /** Flushes/shows everything drawn so far. */
    void present();
}
