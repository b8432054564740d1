package com.yijian.llm.service;

import com.yijian.common.exception.EmbeddingUnavailableException;
import com.yijian.llm.config.LlmProperties;
import com.yijian.llm.embedding.EmbeddingClient;
import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmbeddingServiceTest {

    private EmbeddingClient client;
    private EmbeddingService service;

    @BeforeEach
    void setUp() {
        client = mock(EmbeddingClient.class);
        when(client.getProvider()).thenReturn(LlmProvider.OPENAI);
        LlmProperties properties = new LlmProperties();
        properties.getEmbedding().setTimeoutSeconds(15);
        service = new EmbeddingService(List.of(client), properties);
    }

    @Test
    void returnsTheBackendVector() {
        when(client.embed("资金时间价值", Duration.ofSeconds(15))).thenReturn(new float[]{0.1f, 0.2f});

        assertThat(service.embed("资金时间价值")).containsExactly(0.1f, 0.2f);
    }

    @Test
    void backendFailureIsUnavailableAndNotRetried() {
        when(client.embed(anyString(), any(Duration.class)))
            .thenThrow(new ProviderException("timed out", LlmProvider.OPENAI, 0, true, true, false, null));

        assertThatThrownBy(() -> service.embed("问题"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessageContaining("timed out");
        verify(client, times(1)).embed(anyString(), any(Duration.class));
    }

    @Test
    void malformedVectorIsUnavailable() {
        when(client.embed(anyString(), any(Duration.class))).thenReturn(new float[]{0f, Float.NaN});

        assertThatThrownBy(() -> service.embed("问题"))
            .isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    void usableVectorsAreFiniteAndNonZero() {
        assertThat(EmbeddingService.isUsable(new float[]{0f, 0.5f})).isTrue();
        assertThat(EmbeddingService.isUsable(new float[]{0f, 0f})).isFalse();
        assertThat(EmbeddingService.isUsable(new float[]{Float.POSITIVE_INFINITY})).isFalse();
        assertThat(EmbeddingService.isUsable(new float[0])).isFalse();
        assertThat(EmbeddingService.isUsable(null)).isFalse();
    }
}
