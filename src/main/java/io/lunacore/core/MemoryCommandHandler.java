package io.lunacore.core;

import io.lunacore.memory.FactStore;
import io.lunacore.memory.MemoryEntry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Read-only voice command that lists stored memories. Answers locally without the language model.
 */
@Component
public class MemoryCommandHandler {

    private static final Set<String> LIST_COMMANDS = Set.of("list memories", "memories", "show memories");
    private static final int RECENT_LISTING_LIMIT = 30;

    private final FactStore factStore;

    public MemoryCommandHandler(FactStore factStore) {
        this.factStore = factStore;
    }

    public boolean isMemoryCommand(String utterance) {
        return utterance != null && LIST_COMMANDS.contains(utterance.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * @return the spoken reply when {@code utterance} is a memory command, otherwise empty
     */
    public Optional<String> handle(String utterance) {
        if (!isMemoryCommand(utterance)) {
            return Optional.empty();
        }

        List<MemoryEntry> pinned = factStore.getPinned(Integer.MAX_VALUE);
        // list() puts pinned rows first
        List<MemoryEntry> recent = factStore.list(pinned.size() + RECENT_LISTING_LIMIT).stream()
                .filter(entry -> !entry.pinned())
                .limit(RECENT_LISTING_LIMIT)
                .toList();

        if (pinned.isEmpty() && recent.isEmpty()) {
            return Optional.of("No memories stored yet.");
        }

        StringJoiner reply = new StringJoiner("\n");
        if (!pinned.isEmpty()) {
            reply.add("Pinned memories:");
            pinned.forEach(entry -> reply.add("- " + entry.asLine()));
        }
        if (!recent.isEmpty()) {
            reply.add("Recent memories:");
            recent.forEach(entry -> reply.add("- " + entry.asLine()));
        }
        return Optional.of(reply.toString());
    }
}
