package com.yijian.common.exception;

public class EmptyQueryException extends AnswerEngineException {

    public EmptyQueryException() {
        super(ErrorKind.INVALID_INPUT, "Query text must not be empty");
    }
}
