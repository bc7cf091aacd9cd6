package io.lunacore.core;

import io.lunacore.config.LunaProperties;
import org.springframework.stereotype.Component;

/**
 * Builds the language model prompt for one turn: system instructions, then the pinned facts block
 * (left out entirely when empty), then the user utterance.
 */
@Component
public class PromptAssembler {

    private final PinnedContextProvider contextProvider;
    private final String systemPrompt;

    public PromptAssembler(PinnedContextProvider contextProvider, LunaProperties properties) {
        this.contextProvider = contextProvider;
        this.systemPrompt = properties.assistant().systemPrompt().strip();
    }

    public String assemble(String userUtterance) {
        String utterance = userUtterance == null ? "" : userUtterance.strip();
        String context = contextProvider.pinnedContext();

        var sb = new StringBuilder();
        sb.append(systemPrompt).append('\n');
        if (!context.isBlank()) {
            sb.append(context.strip()).append('\n');
        }
        sb.append("User: ").append(utterance).append('\n');
        sb.append("Assistant:");
        return sb.toString();
    }
}
