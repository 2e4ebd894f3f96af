import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quill.surface.Point;
import com.quill.surface.RecordingSurface;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RecordingSurfaceTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void json_export_shape() throws Exception {
        RecordingSurface s = new RecordingSurface();
        s.lineTo(1.5, 2);
        s.setColor("#ff0000");
        s.drawPolygon(Arrays.asList(new Point(0, 0), new Point(1, 0), new Point(0, 1)));
        s.present();

        ObjectNode tree = s.toJsonTree();
        assertEquals(1, tree.get("presented").asInt());

        JsonNode ops = tree.get("operations");
        assertEquals(3, ops.size());
        assertEquals("lineTo", ops.get(0).get("op").asText());
        assertEquals(1.5, ops.get(0).get("x").asDouble(), 1e-12);
        assertEquals(2.0, ops.get(0).get("y").asDouble(), 1e-12);
        assertEquals("#ff0000", ops.get(1).get("color").asText());

        JsonNode points = ops.get(2).get("points");
        assertEquals(3, points.size());
        assertEquals(1.0, points.get(2).get(1).asDouble(), 1e-12);

        assertEquals(tree, om.readTree(s.toJson()));
    }

    @Test
    void clear_drops_earlier_operations() {
        RecordingSurface s = new RecordingSurface();
        s.moveTo(1, 1);
        s.lineTo(2, 2);
        s.clear();
        s.drawCircle(3, 0, 0);

        assertEquals(2, s.operations().size());
        assertEquals("clear", s.operations().get(0).op);
        assertEquals(3.0, s.operations("drawCircle").get(0).num("radius"), 1e-12);
    }

    @Test
    void polygon_needs_three_points() {
        RecordingSurface s = new RecordingSurface();
        assertThrows(IllegalArgumentException.class,
                () -> s.drawPolygon(Arrays.asList(new Point(0, 0), new Point(1, 1))));
        assertTrue(s.operations().isEmpty());
    }

    @Test
    void recorded_operations_are_read_only() {
        RecordingSurface s = new RecordingSurface();
        s.setWidth(2);
        assertThrows(UnsupportedOperationException.class, () -> s.operations().clear());
        assertThrows(IllegalStateException.class, () -> s.operations().get(0).num("missing"));
    }
}
