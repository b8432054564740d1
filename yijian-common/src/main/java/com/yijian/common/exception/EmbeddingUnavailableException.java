package com.yijian.common.exception;

/**
 * The embedding backend could not produce a usable vector. Never retried silently.
 */
public class EmbeddingUnavailableException extends AnswerEngineException {

    public EmbeddingUnavailableException(String message) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
