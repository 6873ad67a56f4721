package com.clapgrow.tracking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for the JSON endpoints under /api/v1/tracking.
 *
 * <pre>
 * {@code
 * return ResponseEntity.ok(ApiResponse.success(summary));
 * return ResponseEntity.status(401).body(ApiResponse.error("Authentication required"));
 * }
 * </pre>
 *
 * @param <T> Type of the data payload
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    String error
) {
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static ApiResponse<Void> successEmpty() {
        return new ApiResponse<>(true, null, null);
    }

    public static <T> ApiResponse<T> error(String error) {
        return new ApiResponse<>(false, null, error);
    }
}
