package com.yijian.common.exception;

/**
 * A request value the caller can fix. The message is safe to show to the caller.
 */
public class InvalidInputException extends AnswerEngineException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
