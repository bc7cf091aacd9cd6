package io.lunacore.knowledge;

import io.lunacore.core.InvalidInputException;
import io.lunacore.core.StorageException;
import org.jobrunr.jobs.annotations.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Background job that ingests a UTF-8 text file and rebuilds the retrieval index.
 * Runs on a JobRunr worker alongside the live conversation loop.
 */
@Component
public class KnowledgeIngestionJob {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIngestionJob.class);

    private final KnowledgeBase knowledgeBase;

    public KnowledgeIngestionJob(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    @Job(name = "Ingest knowledge file %0", retries = 0)
    public String ingestFile(String filePath, String sourceLabel) {
        Path path = Path.of(filePath);
        if (!Files.isRegularFile(path)) {
            throw new InvalidInputException("Knowledge file not found: " + filePath);
        }

        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Failed to read knowledge file: " + filePath, e);
        }

        String source = sourceLabel == null || sourceLabel.isBlank()
                ? path.getFileName().toString()
                : sourceLabel;
        String documentId = knowledgeBase.ingestText(source, text);
        int indexed = knowledgeBase.rebuildIndex();
        log.info("Background ingestion of {} finished: document {}, index now {} chunks", filePath, documentId, indexed);
        return documentId;
    }
}
