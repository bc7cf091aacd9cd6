package io.lunacore.knowledge;

import org.jobrunr.jobs.Job;
import org.jobrunr.jobs.JobId;
import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.jobs.states.StateName;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.storage.InMemoryStorageProvider;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Enqueues through a real JobScheduler so a lambda that JobRunr cannot analyze fails here
 * instead of at runtime.
 */
class KnowledgeIngestionIntegrationTest {

    private InMemoryStorageProvider storageProvider;
    private KnowledgeIngestionService service;

    @BeforeEach
    void setUp() {
        storageProvider = new InMemoryStorageProvider();
        storageProvider.setJobMapper(new JobMapper(new JacksonJsonMapper()));
        var jobScheduler = new JobScheduler(storageProvider);
        var ingestionJob = new KnowledgeIngestionJob(mock(KnowledgeBase.class));
        service = new KnowledgeIngestionService(jobScheduler, ingestionJob);
    }

    @Test
    void enqueuedJobShouldExistInStorage() {
        JobId jobId = service.enqueueFile("/data/manual.txt", "manual");

        Job job = storageProvider.getJobById(jobId);
        assertEquals(StateName.ENQUEUED, job.getState());
        assertEquals(KnowledgeIngestionJob.class.getName(), job.getJobDetails().getClassName());
        assertEquals("ingestFile", job.getJobDetails().getMethodName());
    }

    @Test
    void jobParametersShouldCarryPathAndSource() {
        JobId jobId = service.enqueueFile("  /data/manual.txt ", "manual");

        Object[] params = storageProvider.getJobById(jobId).getJobDetails().getJobParameterValues();
        assertEquals(2, params.length);
        assertEquals("/data/manual.txt", params[0]);
        assertEquals("manual", params[1]);
    }

    @Test
    void missingSourceShouldDefaultToFileName() {
        JobId jobId = service.enqueueFile("/data/manual.txt", null);

        Job job = storageProvider.getJobById(jobId);
        assertEquals(StateName.ENQUEUED, job.getState());
        assertEquals("manual.txt", job.getJobDetails().getJobParameterValues()[1]);
    }

    @Test
    void blankSourceShouldDefaultToFileName() {
        JobId jobId = service.enqueueFile("/data/notes/wifi.md", "   ");

        Object[] params = storageProvider.getJobById(jobId).getJobDetails().getJobParameterValues();
        assertEquals("wifi.md", params[1]);
    }
}
