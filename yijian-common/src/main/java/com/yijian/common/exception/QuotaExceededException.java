package com.yijian.common.exception;

/**
 * Request budget exhausted, either locally or as reported by the generation backend.
 */
public class QuotaExceededException extends AnswerEngineException {

    public QuotaExceededException(String message) {
        super(ErrorKind.QUOTA_EXCEEDED, message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(ErrorKind.QUOTA_EXCEEDED, message, cause);
    }
}
