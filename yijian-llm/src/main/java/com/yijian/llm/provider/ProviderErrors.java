package com.yijian.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.llm.provider.ProviderClient.ProviderException;
import io.netty.channel.ConnectTimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Translates whatever a blocking {@code WebClient} call threw into a {@link ProviderException}.
 * Status code 0 means no HTTP response was received.
 */
public final class ProviderErrors {

    private ProviderErrors() {
    }

    public static ProviderException translate(Throwable failure, LlmProvider provider, String operation,
                                              ObjectMapper objectMapper) {
        Throwable cause = Exceptions.unwrap(failure);

        if (cause instanceof ProviderException) {
            return (ProviderException) cause;
        }

        if (cause instanceof WebClientResponseException) {
            WebClientResponseException e = (WebClientResponseException) cause;
            int status = e.getStatusCode().value();
            String body = e.getResponseBodyAsString();
            boolean quota = status == 429
                || body.contains("insufficient_quota")
                || body.contains("RESOURCE_EXHAUSTED");
            boolean retryable = !quota && status >= 500;
            String message = String.format("%s %s failed: %d %s", provider.getDisplayName(), operation,
                status, extractErrorMessage(body, e.getStatusText(), objectMapper));
            return new ProviderException(message, provider, status, retryable, false, quota, e);
        }

        if (Thread.currentThread().isInterrupted() || hasCause(cause, InterruptedException.class)) {
            Thread.currentThread().interrupt();
            return new ProviderException(provider.getDisplayName() + " " + operation + " was cancelled",
                provider, 0, false, false, false, cause);
        }

        if (isTimeout(cause)) {
            return new ProviderException(provider.getDisplayName() + " " + operation + " timed out",
                provider, 0, true, true, false, cause);
        }

        if (cause instanceof WebClientRequestException || hasCause(cause, IOException.class)) {
            return new ProviderException(provider.getDisplayName() + " " + operation + " connection failed: "
                + cause.getMessage(), provider, 0, true, false, false, cause);
        }

        return new ProviderException(provider.getDisplayName() + " " + operation + " failed: " + cause.getMessage(),
            provider, 0, false, false, false, cause);
    }

    private static boolean isTimeout(Throwable cause) {
        return hasCause(cause, TimeoutException.class)
            || hasCause(cause, io.netty.handler.timeout.TimeoutException.class)
            || hasCause(cause, ConnectTimeoutException.class);
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        Throwable current = failure;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String extractErrorMessage(String body, String fallback, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (IOException e) {
            // not JSON, keep the status text
            return fallback;
        }
        return fallback;
    }
}
