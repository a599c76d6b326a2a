package com.whothub.gameservice.common;

import com.whothub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * HTTP 接口的全局异常映射。
 * WebSocket 侧的错误不经过这里，由 {@code CommandDispatcher} 转成 session_error。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 协调层业务异常：按错误类别映射 HTTP 状态码。
     */
    @ExceptionHandler(CoordinationException.class)
    public ResponseEntity<ApiResponse<Object>> coordination(CoordinationException e) {
        int status = e.getKind().httpStatus();
        return ResponseEntity.status(status).body(ApiResponse.error(status, e.getMessage()));
    }

    /**
     * 请求体校验失败（@Valid）。
     * @return HTTP 400，消息为第一个字段错误
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(f -> f + " is required")
                .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /**
     * 参数不合法（IllegalArgumentException）。
     * @return HTTP 400（Bad Request）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 业务状态不符合预期（IllegalStateException），例如重复记录同一笔支付。
     * @return HTTP 409（Conflict）
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }

    /**
     * 兜底：持久化协作方等未预期的故障。
     * @return HTTP 500
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> serverError(Exception e) {
        log.error("HTTP 请求处理失败", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.serverError(e.getMessage()));
    }
}
