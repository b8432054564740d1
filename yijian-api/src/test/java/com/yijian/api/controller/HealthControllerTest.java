package com.yijian.api.controller;

import com.yijian.data.model.CorpusStats;
import com.yijian.data.store.VectorKnowledgeStore;
import com.yijian.llm.config.LlmProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
@Import(LlmProperties.class)
@TestPropertySource(properties = {"yijian.llm.api-key=", "yijian.llm.embedding.api-key="})
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VectorKnowledgeStore knowledgeStore;

    @Test
    void healthIsOk() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.message").value("服务运行正常"))
            .andExpect(jsonPath("$.service").value("yijian-tutor"));
    }

    @Test
    void detailedHealthReportsStoreAndProviders() throws Exception {
        when(knowledgeStore.type()).thenReturn("memory");
        when(knowledgeStore.stats()).thenReturn(CorpusStats.builder().total(12).bySubject(Map.of()).build());

        mockMvc.perform(get("/api/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.knowledgeStore.type").value("memory"))
            .andExpect(jsonPath("$.knowledgeStore.status").value("UP"))
            .andExpect(jsonPath("$.knowledgeStore.chunks").value(12))
            .andExpect(jsonPath("$.llm.generationProvider").value("OPENAI"))
            .andExpect(jsonPath("$.llm.apiKeyConfigured").value(false));
    }

    @Test
    void unreachableStoreDegradesHealth() throws Exception {
        when(knowledgeStore.type()).thenReturn("pgvector");
        when(knowledgeStore.stats()).thenThrow(new IllegalStateException("connection refused"));

        mockMvc.perform(get("/api/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.knowledgeStore.status").value("DOWN"))
            .andExpect(jsonPath("$.knowledgeStore.error").value("connection refused"));
    }
}
