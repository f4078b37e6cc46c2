package com.linlay.assistantrunner.model.api;

import org.springframework.http.HttpStatusCode;

import java.util.Map;

public record ApiResponse<T>(
        int code,
        String msg,
        T data
) {

    private static final int SUCCESS_CODE = 0;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "success", data);
    }

    public static ApiResponse<Map<String, Object>> failure(HttpStatusCode status, String msg) {
        return failure(status, msg, Map.of());
    }

    public static <T> ApiResponse<T> failure(HttpStatusCode status, String msg, T data) {
        return new ApiResponse<>(status.value(), msg, data);
    }
}
