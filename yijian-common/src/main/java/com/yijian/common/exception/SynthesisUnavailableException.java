package com.yijian.common.exception;

public class SynthesisUnavailableException extends AnswerEngineException {

    public SynthesisUnavailableException(String message) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message);
    }

    public SynthesisUnavailableException(String message, Throwable cause) {
        super(ErrorKind.BACKEND_UNAVAILABLE, message, cause);
    }
}
