package com.yijian.api.exception;

import com.yijian.api.dto.response.ErrorResponse;
import com.yijian.common.exception.AnswerEngineException;
import com.yijian.common.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Maps every failure to the {@code {"success": false, "error": ...}} envelope. User-facing
 * messages are fixed per error kind; backend details only go to the log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String EMPTY_QUERY_MESSAGE = "请提供问题内容";
    static final String BACKEND_UNAVAILABLE_MESSAGE = "AI 服务暂时不可用，请稍后重试";
    static final String QUOTA_EXCEEDED_MESSAGE = "AI 服务调用额度已用尽，请稍后再试";
    static final String NOT_FOUND_MESSAGE = "接口不存在";
    static final String INTERNAL_ERROR_MESSAGE = "服务器内部错误";

    @ExceptionHandler(AnswerEngineException.class)
    public ResponseEntity<ErrorResponse> handleAnswerEngineException(AnswerEngineException ex, WebRequest request) {
        HttpStatus status;
        String message;
        switch (ex.getKind()) {
            case INVALID_INPUT:
                status = HttpStatus.BAD_REQUEST;
                message = EMPTY_QUERY_MESSAGE;
                log.info("[API] Rejected empty query | path={}", path(request));
                break;
            case QUOTA_EXCEEDED:
                status = HttpStatus.TOO_MANY_REQUESTS;
                message = QUOTA_EXCEEDED_MESSAGE;
                log.warn("[API] Quota exceeded | path={} | error={}", path(request), ex.getMessage());
                break;
            case BACKEND_UNAVAILABLE:
            default:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                message = BACKEND_UNAVAILABLE_MESSAGE;
                log.error("[API] Backend unavailable | path={} | type={} | error={}",
                    path(request), ex.getClass().getSimpleName(), ex.getMessage());
                break;
        }
        return build(status, message, null, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex, WebRequest request) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (errors.length() > 0) {
                errors.append("; ");
            }
            if (error instanceof FieldError) {
                errors.append(((FieldError) error).getField()).append(": ");
            }
            errors.append(error.getDefaultMessage());
        });
        return build(HttpStatus.BAD_REQUEST, errors.toString(), "Validation failed", request);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex, WebRequest request) {
        log.info("[API] Bad request | path={} | error={}", path(request), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, WebRequest request) {
        log.info("[API] Unreadable request body | path={} | error={}", path(request), ex.getMostSpecificCause().getMessage());
        return build(HttpStatus.BAD_REQUEST, "请求体格式错误", null, request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoResourceFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, NOT_FOUND_MESSAGE, null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex, WebRequest request) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, WebRequest request) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE, null, request);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .timestamp(Instant.now())
            .path(path(request))
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }

    private static String path(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
