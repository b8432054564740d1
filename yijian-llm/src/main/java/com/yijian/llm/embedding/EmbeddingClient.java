package com.yijian.llm.embedding;

import com.yijian.llm.provider.LlmProvider;
import com.yijian.llm.provider.ProviderClient.ProviderException;

import java.time.Duration;

public interface EmbeddingClient {

    float[] embed(String text, Duration timeout) throws ProviderException;

    LlmProvider getProvider();
}
