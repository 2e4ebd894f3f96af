import org.junit.jupiter.api.Test;

import com.quill.script.parser.Environment;
import com.quill.script.parser.Value;

import static org.junit.jupiter.api.Assertions.*;

public class EnvironmentTest {

    @Test
    void lookup_walks_outward_and_define_shadows() {
        Environment global = new Environment();
        global.define("a", Value.number(1));

        Environment inner = global.childScope();
        assertEquals(Value.number(1), inner.lookup("a"));

        inner.define("a", Value.number(2));
        assertEquals(Value.number(2), inner.lookup("a"));
        assertEquals(Value.number(1), global.lookup("a"));
        assertTrue(inner.existsInCurrentScope("a"));
        assertSame(global, inner.root());
    }

    @Test
    void assign_updates_nearest_defining_scope() {
        Environment global = new Environment();
        global.define("a", Value.number(1));
        Environment inner = global.childScope().childScope();

        assertTrue(inner.assign("a", Value.string("x")));
        assertEquals(Value.string("x"), global.lookup("a"));
        assertFalse(inner.existsInCurrentScope("a"));

        assertFalse(inner.assign("missing", Value.unit()));
        assertNull(global.lookup("missing"));
    }

    @Test
    void value_printing_and_equality() {
        assertEquals("7", Value.number(7).toString());
        assertEquals("2.5", Value.number(2.5).toString());
        assertEquals("\"hi\"", Value.string("hi").toString());
        assertEquals("unit", Value.unit().toString());
        assertTrue(Value.unit().sameAs(Value.unit()));
        assertThrows(IllegalArgumentException.class, () -> Value.number(1).sameAs(Value.bool(true)));
        assertThrows(IllegalStateException.class, () -> Value.string("s").asNumber());
    }
}
