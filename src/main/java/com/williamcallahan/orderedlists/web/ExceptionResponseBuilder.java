package com.williamcallahan.orderedlists.web;

import com.williamcallahan.orderedlists.domain.errors.ApiErrorResponse;
import com.williamcallahan.orderedlists.domain.errors.ApiResponse;
import com.williamcallahan.orderedlists.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the error and acknowledgement responses shared by the list endpoints.
 */
@Component
public class ExceptionResponseBuilder {

    private static final int MAX_CAUSE_DEPTH = 3;

    /**
     * Builds an error response with status and message.
     *
     * @param status HTTP status code
     * @param message error message
     * @return error response entity
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response carrying a description of the exception.
     *
     * @param status HTTP status code
     * @param message error message
     * @param exception exception that occurred
     * @return error response entity
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception and its first causes.
     *
     * @param exception exception to describe
     * @return description, or {@code null} when no exception is given
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder details = new StringBuilder(describeThrowable(exception));
        Throwable cause = exception.getCause();
        int depth = 0;
        while (cause != null && cause != exception && depth < MAX_CAUSE_DEPTH) {
            details.append("; cause=").append(describeThrowable(cause));
            cause = cause.getCause();
            depth++;
        }
        return details.toString();
    }

    private static String describeThrowable(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return throwable.getClass().getSimpleName() + ": " + message;
    }
}
