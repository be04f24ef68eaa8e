package com.williamcallahan.orderedlists.domain.errors;

import java.util.Objects;

/**
 * JSON error payload for requests the list API could not serve.
 *
 * @param status fixed status indicator ("error")
 * @param message what went wrong, for the caller
 * @param details exception description, or {@code null}
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
