package io.lunacore.channel;

import io.lunacore.config.LunaProperties;
import io.lunacore.knowledge.IndexStatus;
import io.lunacore.knowledge.KnowledgeBase;
import io.lunacore.knowledge.KnowledgeIngestionService;
import io.lunacore.knowledge.RetrievedChunk;
import org.jobrunr.jobs.JobId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(KnowledgeController.class)
@Import(KnowledgeControllerTest.Settings.class)
class KnowledgeControllerTest {

    @TestConfiguration
    static class Settings {
        @Bean
        LunaProperties lunaProperties() {
            return new LunaProperties(null, null,
                    new LunaProperties.Knowledge(null, 3, 0.5, null, null, false), null);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private KnowledgeBase knowledgeBase;

    @MockBean
    private KnowledgeIngestionService ingestionService;

    @Test
    void shouldIngestAndOptionallyRebuild() throws Exception {
        when(knowledgeBase.ingestText("manual", "Audio goes through the jack.")).thenReturn("doc-1");

        mockMvc.perform(post("/api/knowledge/documents")
                        .param("rebuild", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"source": "manual", "text": "Audio goes through the jack."}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("doc-1"))
                .andExpect(jsonPath("$.indexRebuilt").value(true));

        verify(knowledgeBase).rebuildIndex();
    }

    @Test
    void shouldEnqueueFileIngestion() throws Exception {
        var jobId = new JobId(UUID.fromString("7f1f4c8e-5b0e-4f7b-9d55-1e2a3b4c5d6e"));
        when(ingestionService.enqueueFile("/data/manual.txt", "manual")).thenReturn(jobId);

        mockMvc.perform(post("/api/knowledge/documents/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"path": "/data/manual.txt", "source": "manual"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("7f1f4c8e-5b0e-4f7b-9d55-1e2a3b4c5d6e"));
    }

    @Test
    void shouldSearchWithConfiguredDefaults() throws Exception {
        when(knowledgeBase.retrieve("audio", 3, 0.5)).thenReturn(List.of(
                new RetrievedChunk("doc-1", "manual", 0, "Audio goes through the jack.", 1.23)));

        mockMvc.perform(get("/api/knowledge/search").param("query", "audio"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].source").value("manual"))
                .andExpect(jsonPath("$[0].score").value(1.23));
    }

    @Test
    void shouldSearchWithExplicitLimit() throws Exception {
        when(knowledgeBase.retrieve("audio", 2, 0.5)).thenReturn(List.of());

        mockMvc.perform(get("/api/knowledge/search").param("query", "audio").param("k", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(knowledgeBase).retrieve("audio", 2, 0.5);
    }

    @Test
    void shouldSearchWithExplicitMinScoreAndConfiguredLimit() throws Exception {
        when(knowledgeBase.retrieve("audio", 3, 2.0)).thenReturn(List.of());

        mockMvc.perform(get("/api/knowledge/search").param("query", "audio").param("minScore", "2.0"))
                .andExpect(status().isOk());

        verify(knowledgeBase).retrieve("audio", 3, 2.0);
        verify(knowledgeBase, never()).retrieve("audio");
    }

    @Test
    void shouldReportIndexStatus() throws Exception {
        when(knowledgeBase.indexStatus()).thenReturn(new IndexStatus(false, true, 0, null));

        mockMvc.perform(get("/api/knowledge/index"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.built").value(false))
                .andExpect(jsonPath("$.stale").value(true));
    }
}
