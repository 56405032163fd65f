package com.github.dimitryivaniuta.linkorganizer.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Envelope shared by every API endpoint. The HTTP status carries the primary signal;
 * {@code success} mirrors it for clients that only look at the body.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data,
        String message,
        String error,
        Integer count
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message, null, null);
    }

    public static <T> ApiResponse<List<T>> list(List<T> data) {
        return new ApiResponse<>(true, data, null, null, data.size());
    }

    public static ApiResponse<Void> message(String message) {
        return new ApiResponse<>(true, null, message, null, null);
    }

    public static ApiResponse<Void> error(String message, String error) {
        return new ApiResponse<>(false, null, message, error, null);
    }
}
