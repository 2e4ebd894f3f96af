package com.quill.script.parser;

/**
 * Pen position, heading and pen flag.
 *
 * Heading is in degrees, counter-clockwise, 0 pointing right and 90 pointing up.
 * Relative commands (forward, left, ...) are resolved here into the absolute
 * coordinates a DrawingSurface understands.
 */
public final class TurtleState {
    public static final double HOME_HEADING = 90.0;

    private double x;
    private double y;
    private double heading = HOME_HEADING;
    private boolean penDown = true;

    public double x() { return x; }
    public double y() { return y; }
    public double heading() { return heading; }
    public boolean isPenDown() { return penDown; }

    public void setPenDown(boolean down) { this.penDown = down; }

    public void moveTo(double nx, double ny) {
        this.x = nx;
        this.y = ny;
    }

    /** Destination of a move of {@code distance} along the current heading. */
    public double[] ahead(double distance) {
        double rad = Math.toRadians(heading);
        return new double[] { x + distance * Math.cos(rad), y + distance * Math.sin(rad) };
    }

    public void turn(double degrees) {
        heading = normalize(heading + degrees);
    }

    public void setHeading(double degrees) {
        heading = normalize(degrees);
    }

    public void reset() {
        x = 0;
        y = 0;
        heading = HOME_HEADING;
        penDown = true;
    }

    private static double normalize(double deg) {
        double d = deg % 360.0;
        return (d < 0) ? d + 360.0 : d;
    }
}
