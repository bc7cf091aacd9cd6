package io.lunacore.setup;

import io.lunacore.knowledge.KnowledgeBase;
import io.lunacore.memory.FactStore;
import io.lunacore.storage.LunaDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Irreversible reset: clears memories, turns and sessions, optionally the knowledge base, then
 * compacts the database file.
 */
@Service
public class ResetService {

    private static final Logger log = LoggerFactory.getLogger(ResetService.class);

    private final FactStore factStore;
    private final KnowledgeBase knowledgeBase;
    private final LunaDatabase database;

    public ResetService(FactStore factStore, KnowledgeBase knowledgeBase, LunaDatabase database) {
        this.factStore = factStore;
        this.knowledgeBase = knowledgeBase;
        this.database = database;
    }

    public void resetAll(boolean includeKnowledge) {
        log.warn("Resetting Luna storage (knowledge included: {})", includeKnowledge);
        factStore.deleteAll();
        if (includeKnowledge) {
            knowledgeBase.deleteAll();
        }
        database.compact();
    }
}
