package io.lunacore.knowledge;

import io.lunacore.config.LunaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Builds the retrieval index once the application is ready, so the first retrieval after a restart
 * sees every persisted chunk.
 */
@Component
public class KnowledgeIndexWarmup {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIndexWarmup.class);

    private final KnowledgeBase knowledgeBase;
    private final boolean enabled;

    public KnowledgeIndexWarmup(KnowledgeBase knowledgeBase, LunaProperties properties) {
        this.knowledgeBase = knowledgeBase;
        this.enabled = properties.knowledge().rebuildOnStartup();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        if (!enabled) {
            log.info("Index rebuild on startup disabled; retrieval stays empty until the first rebuild");
            return;
        }
        int chunks = knowledgeBase.rebuildIndex();
        log.info("Startup index build complete: {} chunks", chunks);
    }
}
