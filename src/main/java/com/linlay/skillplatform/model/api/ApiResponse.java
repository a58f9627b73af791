package com.linlay.skillplatform.model.api;

import org.springframework.http.HttpStatusCode;

import java.util.Map;

public record ApiResponse<T>(
        int code,
        String msg,
        T data
) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(0, "success", data);
    }

    public static ApiResponse<Map<String, Object>> failure(HttpStatusCode status, String msg) {
        return failure(status, msg, Map.of());
    }

    public static <T> ApiResponse<T> failure(HttpStatusCode status, String msg, T data) {
        return new ApiResponse<>(status.value(), msg == null ? "" : msg, data);
    }
}
