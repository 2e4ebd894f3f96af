import org.junit.jupiter.api.Test;

import com.quill.script.QuillScript;
import com.quill.script.RunResult;
import com.quill.script.parser.ErrorKind;
import com.quill.script.parser.Value;
import com.quill.script.plugins.DrawingCommands;
import com.quill.surface.DrawOp;
import com.quill.surface.Point;
import com.quill.surface.RecordingSurface;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QuillDrawingCommandsTest {

    private final QuillScript engine = new QuillScript();
    private final RecordingSurface surface = new RecordingSurface();

    private Value draw(String src) {
        RunResult r = engine.run(src, surface);
        assertTrue(r.isSuccess(), () -> "unexpected failure: " + r);
        return r.value();
    }

    private RunResult drawFailing(String src) {
        RunResult r = engine.run(src, surface);
        assertFalse(r.isSuccess(), () -> "expected failure, got " + r);
        return r;
    }

    private List<String> opNames() {
        List<String> out = new ArrayList<>();
        for (DrawOp op : surface.operations()) out.add(op.op);
        return out;
    }

    @Test
    void forward_from_home_draws_upwards() {
        draw("forward(100)");

        List<DrawOp> lines = surface.operations("lineTo");
        assertEquals(1, lines.size());
        assertEquals(0.0, lines.get(0).num("x"), 1e-9);
        assertEquals(100.0, lines.get(0).num("y"), 1e-9);
    }

    @Test
    void pen_up_moves_without_drawing() {
        draw("penup()\nforward(50)\npendown()\nright(90)\nforward(20)");

        assertEquals(Arrays.asList("setPenDown", "moveTo", "setPenDown", "lineTo"), opNames());
        DrawOp move = surface.operations("moveTo").get(0);
        assertEquals(50.0, move.num("y"), 1e-9);
        DrawOp line = surface.operations("lineTo").get(0);
        assertEquals(20.0, line.num("x"), 1e-9);
        assertEquals(50.0, line.num("y"), 1e-9);
    }

    @Test
    void aliases_behave_like_full_names() {
        draw("fd(10)\nlt(90)\nfd(10)\nbk(5)");

        List<DrawOp> lines = surface.operations("lineTo");
        assertEquals(3, lines.size());
        assertEquals(-10.0, lines.get(1).num("x"), 1e-9);
        assertEquals(10.0, lines.get(1).num("y"), 1e-9);
        assertEquals(-5.0, lines.get(2).num("x"), 1e-9);
    }

    @Test
    void turtle_queries() {
        assertEquals(10.0, draw("fd(10)\nypos()").asNumber(), 1e-9);
        assertEquals(180.0, draw("seth(180)\nheading()").asNumber(), 1e-9);
        assertEquals(100.0, draw("seth(90)\nleft(370)\nheading()").asNumber(), 1e-9);
        assertEquals(45.0, draw("seth(90)\nright(45)\nheading()").asNumber(), 1e-9);
    }

    @Test
    void goto_and_home() {
        assertEquals(0.0, draw("penup()\ngoto(10, 10)\nhome()\nxpos() + ypos()").asNumber(), 1e-9);

        List<DrawOp> moves = surface.operations("moveTo");
        DrawOp last = moves.get(moves.size() - 1);
        assertEquals(0.0, last.num("x"), 1e-9);
        assertEquals(0.0, last.num("y"), 1e-9);
    }

    @Test
    void circle_defaults_to_turtle_position() {
        draw("penup()\ngoto(5, 6)\ncircle(3)\ncircle(1, 2, 3)");

        List<DrawOp> circles = surface.operations("drawCircle");
        assertEquals(2, circles.size());
        assertEquals(3.0, circles.get(0).num("radius"), 1e-9);
        assertEquals(5.0, circles.get(0).num("centerX"), 1e-9);
        assertEquals(6.0, circles.get(0).num("centerY"), 1e-9);
        assertEquals(2.0, circles.get(1).num("centerX"), 1e-9);

        RunResult bad = drawFailing("circle(1, 2)");
        assertEquals(ErrorKind.ARGUMENT_COUNT_MISMATCH, bad.error().kind());
        assertEquals("circle() expects 1 or 3 arguments, got 2", bad.error().detail());
    }

    @Test
    void rectangle_line_and_arc() {
        draw("penup()\ngoto(1, 1)\nrect(10, 20)\nrectangle(1, 2, 3, 4)\nline(0, 0, 5, 5)\narc(10, 20)\narc(10, 20, 90, 7, 8)");

        List<DrawOp> rects = surface.operations("drawRectangle");
        assertEquals(1.0, rects.get(0).num("x"), 1e-9);
        assertEquals(20.0, rects.get(0).num("height"), 1e-9);
        assertEquals(3.0, rects.get(1).num("x"), 1e-9);

        assertEquals(5.0, surface.operations("drawLine").get(0).num("y2"), 1e-9);

        List<DrawOp> arcs = surface.operations("drawArc");
        assertEquals(0.0, arcs.get(0).num("angle"), 1e-9);
        assertEquals(1.0, arcs.get(0).num("centerX"), 1e-9);
        assertEquals(90.0, arcs.get(1).num("angle"), 1e-9);
        assertEquals(8.0, arcs.get(1).num("centerY"), 1e-9);

        assertEquals(ErrorKind.ARGUMENT_COUNT_MISMATCH, drawFailing("arc(1, 2, 3, 4)").error().kind());
    }

    @Test
    void polygon_takes_coordinate_pairs() {
        draw("polygon(0, 0, 10, 0, 0, 10)");

        @SuppressWarnings("unchecked")
        List<Point> points = (List<Point>) surface.operations("drawPolygon").get(0).args.get("points");
        assertEquals(Arrays.asList(new Point(0, 0), new Point(10, 0), new Point(0, 10)), points);

        assertEquals(ErrorKind.ARGUMENT_COUNT_MISMATCH, drawFailing("polygon(0, 0, 1, 1)").error().kind());
        assertEquals(ErrorKind.ARGUMENT_COUNT_MISMATCH, drawFailing("polygon(0, 0, 1, 1, 2, 2, 3)").error().kind());
    }

    @Test
    void pen_style_commands() {
        draw("color(\"red\")\nwidth(3)\nfill()\nnofill()");

        assertEquals(Arrays.asList("setColor", "setWidth", "setFill", "setFill"), opNames());
        assertEquals("red", surface.operations("setColor").get(0).args.get("color"));
        assertEquals(Boolean.FALSE, surface.operations("setFill").get(1).args.get("fill"));

        assertEquals(ErrorKind.INVALID_ARGUMENT_TYPE, drawFailing("color(5)").error().kind());
        assertEquals(ErrorKind.INVALID_ARGUMENT_TYPE, drawFailing("width(-1)").error().kind());
    }

    @Test
    void clear_reset_show() {
        draw("fd(10)\nclear()");
        assertEquals(Arrays.asList("clear"), opNames());

        assertEquals(90.0, draw("fd(10)\nright(45)\nreset()\nheading()").asNumber(), 1e-9);
        assertFalse(surface.operations("resetState").isEmpty());

        draw("show()\nhide()");
        assertEquals(1, surface.presentCount());
    }

    @Test
    void argument_type_error_points_at_the_call() {
        RunResult r = drawFailing("fd(1)\n  fd(\"a\")");
        assertEquals(ErrorKind.INVALID_ARGUMENT_TYPE, r.error().kind());
        assertEquals(2, r.error().line());
        assertEquals(3, r.error().column());
    }

    @Test
    void drawing_commands_win_over_user_functions() {
        Value v = draw("function circle(r) { return 99 }\ncircle(5)");
        assertTrue(v.isUnit());
        assertEquals(1, surface.operations("drawCircle").size());
    }

    @Test
    void command_names_include_aliases() {
        assertTrue(DrawingCommands.NAMES.containsAll(Arrays.asList(
                "forward", "fd", "backward", "bk", "left", "lt", "right", "rt", "penup", "pu",
                "pendown", "pd", "rectangle", "rect", "setheading", "seth", "xpos", "ypos", "heading")));
        assertFalse(DrawingCommands.NAMES.contains("sin"));
    }
}
