package com.yijian.llm.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Shared WebClient setup for the generation and embedding backends.
 * Per-call deadlines are applied by the clients; the response timeout here is only a backstop.
 */
@Configuration
public class WebClientConfig {

    // 1536-dim embedding responses run to a few hundred KB of JSON
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    @Bean
    public WebClient.Builder webClientBuilder(LlmProperties properties) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        int backstopSeconds = Math.max(properties.getSynthesisTimeoutSeconds(),
                properties.getEmbedding().getTimeoutSeconds()) + 5;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(backstopSeconds))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS);

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
