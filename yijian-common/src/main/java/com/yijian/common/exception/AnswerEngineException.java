package com.yijian.common.exception;

/**
 * Base type for every failure the answer engine reports to its callers.
 */
public abstract class AnswerEngineException extends RuntimeException {

    private final ErrorKind kind;

    protected AnswerEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnswerEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
