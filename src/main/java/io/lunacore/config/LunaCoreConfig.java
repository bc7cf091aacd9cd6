package io.lunacore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lunacore.capture.FactCaptureService;
import io.lunacore.capture.FactExtractor;
import io.lunacore.capture.RuleBasedFactExtractor;
import io.lunacore.knowledge.DocumentChunker;
import io.lunacore.knowledge.KnowledgeBase;
import io.lunacore.knowledge.SQLiteKnowledgeBase;
import io.lunacore.ledger.SQLiteTurnLedger;
import io.lunacore.ledger.TurnLedger;
import io.lunacore.memory.FactStore;
import io.lunacore.memory.MemorySeedLoader;
import io.lunacore.memory.PinnedMemoryCache;
import io.lunacore.memory.SQLiteFactStore;
import io.lunacore.storage.LunaDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the storage-backed components from {@link LunaProperties}.
 */
@Configuration
@EnableConfigurationProperties(LunaProperties.class)
public class LunaCoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(initMethod = "init", destroyMethod = "close")
    public LunaDatabase lunaDatabase(LunaProperties properties) {
        return new LunaDatabase(properties.storage().path());
    }

    @Bean
    public PinnedMemoryCache pinnedMemoryCache(LunaProperties properties, Clock clock) {
        return new PinnedMemoryCache(properties.memory().pinnedCacheTtl(), clock);
    }

    @Bean
    public FactStore factStore(LunaDatabase database, PinnedMemoryCache cache, Clock clock, LunaProperties properties) {
        return new SQLiteFactStore(database, cache, clock, properties.memory().nonPinnedCap());
    }

    @Bean
    public TurnLedger turnLedger(LunaDatabase database, ObjectMapper objectMapper, Clock clock) {
        return new SQLiteTurnLedger(database, objectMapper, clock);
    }

    @Bean
    public KnowledgeBase knowledgeBase(LunaDatabase database, Clock clock, LunaProperties properties) {
        var knowledge = properties.knowledge();
        return new SQLiteKnowledgeBase(database, new DocumentChunker(knowledge.chunkChars()), clock,
                knowledge.topK(), knowledge.minScore(), knowledge.k1(), knowledge.b());
    }

    @Bean
    public MemorySeedLoader memorySeedLoader(FactStore factStore, LunaProperties properties) {
        return new MemorySeedLoader(factStore, properties.memory().seedScore(), properties.memory().nonPinnedCap());
    }

    @Bean
    @ConditionalOnMissingBean
    public FactExtractor factExtractor() {
        return new RuleBasedFactExtractor();
    }

    @Bean
    public FactCaptureService factCaptureService(FactExtractor extractor, FactStore factStore, LunaProperties properties) {
        return new FactCaptureService(extractor, factStore, properties.memory().captureEnabled());
    }
}
