package io.lunacore.core;

import io.lunacore.config.LunaProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PromptAssemblerTest {

    private final PinnedContextProvider contextProvider = mock(PinnedContextProvider.class);

    private static LunaProperties withSystemPrompt(String systemPrompt) {
        return new LunaProperties(null, null, null, new LunaProperties.Assistant(systemPrompt));
    }

    @Test
    void shouldPlacePinnedFactsBetweenSystemPromptAndUtterance() {
        when(contextProvider.pinnedContext()).thenReturn("Pinned user facts (trusted):\n- name: Carlos");
        var assembler = new PromptAssembler(contextProvider, withSystemPrompt("You are Luna."));

        String prompt = assembler.assemble("  what's my name? ");

        assertEquals("""
                You are Luna.
                Pinned user facts (trusted):
                - name: Carlos
                User: what's my name?
                Assistant:""", prompt);
    }

    @Test
    void shouldOmitContextBlockWhenNoPinnedFacts() {
        when(contextProvider.pinnedContext()).thenReturn("");
        var assembler = new PromptAssembler(contextProvider, withSystemPrompt("You are Luna."));

        assertEquals("You are Luna.\nUser: hello\nAssistant:", assembler.assemble("hello"));
    }

    @Test
    void shouldUseDefaultSystemPromptWhenNoneConfigured() {
        when(contextProvider.pinnedContext()).thenReturn("");
        var assembler = new PromptAssembler(contextProvider, new LunaProperties(null, null, null, null));

        assertTrue(assembler.assemble("hi").startsWith("You are Luna, a helpful voice assistant.\n"));
    }
}
