package com.whothub.web.common;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * HTTP 接口统一响应外壳。
 * <p>
 * code 与 HTTP 状态码保持一致：200 成功，400 参数错误，404 资源不存在，409 业务冲突，500 服务器错误。
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static final int OK = 200;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(OK, "success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(OK, message, data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }

    /** 是否成功（不参与序列化） */
    @JsonIgnore
    public boolean isSuccess() {
        return code == OK;
    }
}
