package io.lunacore.core;

import io.lunacore.config.LunaProperties;
import io.lunacore.memory.FactStore;
import io.lunacore.memory.PinnedContextFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Supplies the pinned-facts block for each conversation turn.
 * A storage failure degrades to an empty context instead of aborting the turn.
 */
@Component
public class PinnedContextProvider {

    private static final Logger log = LoggerFactory.getLogger(PinnedContextProvider.class);

    private final FactStore factStore;
    private final int limit;

    public PinnedContextProvider(FactStore factStore, LunaProperties properties) {
        this.factStore = factStore;
        this.limit = properties.memory().pinnedContextLimit();
    }

    public String pinnedContext() {
        try {
            return PinnedContextFormatter.format(factStore.getPinned(limit));
        } catch (StorageException e) {
            log.warn("Pinned memories unavailable, continuing without them: {}", e.getMessage());
            return "";
        }
    }
}
