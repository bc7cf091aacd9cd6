package io.lunacore.core;

import io.lunacore.memory.FactStore;
import io.lunacore.memory.MemoryEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class MemoryCommandHandlerTest {

    private final FactStore factStore = mock(FactStore.class);
    private final MemoryCommandHandler handler = new MemoryCommandHandler(factStore);

    @Test
    void shouldRecognizeListingCommands() {
        assertTrue(handler.isMemoryCommand("List memories"));
        assertTrue(handler.isMemoryCommand("  memories "));
        assertFalse(handler.isMemoryCommand("remember my keys are in the drawer"));
        assertFalse(handler.isMemoryCommand(null));
    }

    @Test
    void shouldListPinnedThenRecentMemories() {
        var pinned = new MemoryEntry("name", "Carlos", 3.0, true, Instant.EPOCH);
        var recent = new MemoryEntry("user_location", "Porto", 0.8, false, Instant.EPOCH);
        when(factStore.getPinned(anyInt())).thenReturn(List.of(pinned));
        when(factStore.list(anyInt())).thenReturn(List.of(pinned, recent));

        Optional<String> reply = handler.handle("show memories");

        assertEquals(Optional.of("Pinned memories:\n- name: Carlos\nRecent memories:\n- user_location: Porto"), reply);
    }

    @Test
    void shouldSayWhenNothingIsStored() {
        when(factStore.getPinned(anyInt())).thenReturn(List.of());
        when(factStore.list(anyInt())).thenReturn(List.of());

        assertEquals(Optional.of("No memories stored yet."), handler.handle("memories"));
    }

    @Test
    void shouldIgnoreOtherUtterances() {
        assertTrue(handler.handle("what's the time").isEmpty());
        verifyNoInteractions(factStore);
    }
}
