import org.junit.jupiter.api.Test;

import com.quill.debug.DebugLevel;
import com.quill.script.QuillConfig;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class QuillConfigTest {

    @Test
    void defaults() {
        QuillConfig c = QuillConfig.defaults();
        assertEquals(200, c.maxCallDepth());
        assertNull(c.randomSeed());
        assertEquals(DebugLevel.WARN, c.debugLevel());
        assertNull(c.outputPath());
        assertEquals(0L, c.timeoutMs());
    }

    @Test
    void loads_every_key_from_file() throws Exception {
        Path file = Path.of(QuillConfigTest.class.getResource("/quill-test-config.json").toURI());
        QuillConfig c = QuillConfig.load(file);

        assertEquals(50, c.maxCallDepth());
        assertEquals(Long.valueOf(42L), c.randomSeed());
        assertEquals(DebugLevel.DEBUG, c.debugLevel());
        assertEquals("out.json", c.outputPath());
        assertEquals(1500L, c.timeoutMs());
    }

    @Test
    void missing_keys_keep_defaults() {
        QuillConfig c = QuillConfig.fromJson("{\"timeoutMs\": 10}");
        assertEquals(10L, c.timeoutMs());
        assertEquals(200, c.maxCallDepth());
        assertEquals(DebugLevel.WARN, c.debugLevel());
    }

    @Test
    void unknown_key_is_rejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> QuillConfig.fromJson("{\"colour\": \"red\"}"));
        assertEquals("Unknown config key: colour", e.getMessage());
    }

    @Test
    void bad_values_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> QuillConfig.fromJson("{\"maxCallDepth\": \"deep\"}"));
        assertThrows(IllegalArgumentException.class, () -> QuillConfig.fromJson("{\"maxCallDepth\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> QuillConfig.fromJson("{\"debugLevel\": \"LOUD\"}"));
        assertThrows(IllegalArgumentException.class, () -> QuillConfig.fromJson("{\"timeoutMs\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> QuillConfig.fromJson("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> QuillConfig.fromJson("{not json"));
    }

    @Test
    void with_methods_copy() {
        QuillConfig base = QuillConfig.defaults();
        QuillConfig changed = base.withMaxCallDepth(10).withOutputPath("a.json");
        assertEquals(10, changed.maxCallDepth());
        assertEquals("a.json", changed.outputPath());
        assertEquals(200, base.maxCallDepth());
    }
}
