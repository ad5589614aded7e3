package com.example.playout.common;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope for every endpoint: {@code success}, an optional message, the payload in {@code data}
 * and free-form diagnostics in {@code meta}.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
