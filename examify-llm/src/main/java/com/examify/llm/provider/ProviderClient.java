package com.examify.llm.provider;

/**
 * Text generation against one vendor. Exactly one implementation is active, picked by
 * {@code examify.llm.provider} when {@code LlmService} starts.
 */
public interface ProviderClient {

    String generateContent(String systemInstruction, String prompt) throws ProviderException;

    String getProviderName();

    String getModel();

    default boolean requiresApiKey() {
        return true;
    }

    class ProviderException extends RuntimeException {
        private final boolean retryable;
        private final int statusCode;
        private final String provider;

        public ProviderException(String message, String provider, int statusCode, boolean retryable) {
            super(message);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public ProviderException(String message, String provider, int statusCode, boolean retryable, Throwable cause) {
            super(message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public boolean isRetryable() { return retryable; }
        public int getStatusCode() { return statusCode; }
        public String getProvider() { return provider; }
        public boolean isRateLimited() { return statusCode == 429; }
        public boolean isAuthError() { return statusCode == 401 || statusCode == 403; }

        /**
         * Same failure, marked as no longer worth retrying.
         */
        public ProviderException asPermanent(String message) {
            return new ProviderException(message, provider, statusCode, false, this);
        }
    }
}
