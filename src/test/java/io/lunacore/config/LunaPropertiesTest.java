package io.lunacore.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LunaPropertiesTest {

    @Test
    void shouldFillDefaultsForMissingSections() {
        var props = new LunaProperties(null, null, null, null);

        assertEquals("./data/luna.db", props.storage().path());
        assertEquals(Duration.ofSeconds(15), props.memory().pinnedCacheTtl());
        assertEquals(500, props.memory().nonPinnedCap());
        assertEquals(50, props.memory().pinnedContextLimit());
        assertEquals(3.0, props.memory().seedScore());
        assertFalse(props.memory().captureEnabled());
        assertEquals(1200, props.knowledge().chunkChars());
        assertEquals(5, props.knowledge().topK());
        assertEquals(1.5, props.knowledge().k1());
        assertEquals(0.75, props.knowledge().b());
        assertTrue(props.knowledge().rebuildOnStartup());
        assertFalse(props.assistant().systemPrompt().isBlank());
    }

    @Test
    void shouldKeepExplicitValues() {
        var memory = new LunaProperties.Memory(Duration.ZERO, 10, 5, 1.0, true);

        assertEquals(Duration.ZERO, memory.pinnedCacheTtl());
        assertEquals(10, memory.nonPinnedCap());
        assertTrue(memory.captureEnabled());
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
                () -> new LunaProperties.Memory(Duration.ofSeconds(-1), null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new LunaProperties.Memory(null, -1, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new LunaProperties.Knowledge(0, null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new LunaProperties.Knowledge(null, null, null, null, 1.2, null));
    }
}
