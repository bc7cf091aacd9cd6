package io.lunacore.knowledge;

import io.lunacore.core.InvalidInputException;
import org.jobrunr.jobs.JobId;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Enqueues background ingestion through JobRunr.
 */
@Service
public class KnowledgeIngestionService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIngestionService.class);

    private final JobScheduler jobScheduler;
    private final KnowledgeIngestionJob ingestionJob;

    public KnowledgeIngestionService(JobScheduler jobScheduler, KnowledgeIngestionJob ingestionJob) {
        this.jobScheduler = jobScheduler;
        this.ingestionJob = ingestionJob;
    }

    /**
     * Enqueues ingestion of a text file followed by an index rebuild.
     * A missing or blank source label defaults to the file name.
     *
     * @return the JobRunr job id
     */
    public JobId enqueueFile(String filePath, String sourceLabel) {
        String path = InvalidInputException.requireText(filePath, "path");
        String source = sourceLabel == null || sourceLabel.isBlank() ? defaultSource(path) : sourceLabel.strip();
        // JobRunr rejects null job parameters, so both arguments are resolved here
        JobId jobId = jobScheduler.enqueue(() -> ingestionJob.ingestFile(path, source));
        log.info("Enqueued ingestion of {} from '{}' as job {}", path, source, jobId);
        return jobId;
    }

    private static String defaultSource(String path) {
        Path fileName;
        try {
            fileName = Path.of(path).getFileName();
        } catch (InvalidPathException e) {
            throw new InvalidInputException("'path' is not a valid file path: " + path);
        }
        return fileName == null ? path : fileName.toString();
    }
}
