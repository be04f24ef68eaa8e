package com.williamcallahan.orderedlists.domain.errors;

import java.util.Objects;

/**
 * JSON acknowledgement for commands that return no data, such as clearing the grammar cache.
 *
 * @param status fixed status indicator ("success")
 * @param message confirmation text
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {
    private static final String STATUS_SUCCESS = "success";

    public ApiSuccessResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Success message is required");
    }

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse(STATUS_SUCCESS, message);
    }
}
