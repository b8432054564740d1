package com.yijian.common.exception;

/**
 * Coarse failure categories the HTTP layer maps onto status codes.
 */
public enum ErrorKind {
    INVALID_INPUT,
    BACKEND_UNAVAILABLE,
    QUOTA_EXCEEDED
}
