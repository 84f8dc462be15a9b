package com.work.relay.app.web;

import com.work.relay.app.web.dto.ErrorResponse;
import com.work.relay.core.exception.RelayErrorCode;
import com.work.relay.core.exception.RelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 把组件异常翻译为稳定的 {code, message}；原始异常只进日志，不返回给调用方。
 */
@RestControllerAdvice
public class RelayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayExceptionHandler.class);

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<ErrorResponse> handleRelay(RelayException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("[relay] 请求失败, code={}, detail={}", e.getCode(), e.getMessage(), e);
        } else {
            log.warn("[relay] 请求被拒绝, code={}, detail={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode().name(), e.getPublicMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleArgument(IllegalArgumentException e) {
        log.warn("[relay] 参数错误: {}", e.getMessage());
        return argumentError(e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError == null ? "invalid request" : fieldError.getDefaultMessage();
        log.warn("[relay] 参数校验失败: {}", message);
        return argumentError(message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception e) {
        log.warn("[relay] 请求格式错误: {}", e.getMessage());
        return argumentError("malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[relay] 未预期的异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(RelayErrorCode.INTERNAL.name(), "internal error"));
    }

    static HttpStatus statusOf(RelayErrorCode code) {
        switch (code) {
            case ARGUMENT_ERROR:
                return HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED:
                return HttpStatus.UNAUTHORIZED;
            case QUOTA_EXCEEDED:
                return HttpStatus.PAYMENT_REQUIRED;
            case DUPLICATE_AUTHORIZATION:
            case ILLEGAL_STATE_TRANSITION:
                return HttpStatus.CONFLICT;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case GAS_ESTIMATION_FAILED:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case UPSTREAM_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<ErrorResponse> argumentError(String message) {
        return ResponseEntity.badRequest().body(new ErrorResponse(RelayErrorCode.ARGUMENT_ERROR.name(), message));
    }
}
