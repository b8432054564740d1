package com.yijian.llm.provider;

import java.time.Duration;

public interface ProviderClient {

    /**
     * Runs one generation call. Never retries on its own; the caller decides.
     */
    String generateContent(String systemPrompt, String prompt, Duration timeout) throws ProviderException;

    LlmProvider getProvider();

    class ProviderException extends RuntimeException {
        private final LlmProvider provider;
        private final int statusCode;
        private final boolean retryable;
        private final boolean timeout;
        private final boolean quotaExhausted;

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable) {
            this(message, provider, statusCode, retryable, false, false, null);
        }

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable,
                                 boolean timeout, boolean quotaExhausted, Throwable cause) {
            super(message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
            this.timeout = timeout;
            this.quotaExhausted = quotaExhausted;
        }

        public LlmProvider getProvider() { return provider; }
        public int getStatusCode() { return statusCode; }
        public boolean isRetryable() { return retryable; }
        public boolean isTimeout() { return timeout; }
        public boolean isQuotaExhausted() { return quotaExhausted; }
        public boolean isAuthError() { return statusCode == 401 || statusCode == 403; }
    }
}
