package com.williamcallahan.orderedlists.domain.errors;

/**
 * Status envelope shared by the JSON error and acknowledgement payloads of the list API.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return {@code "error"} or {@code "success"}
     */
    String status();
}
