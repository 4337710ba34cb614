package com.williamcallahan.refrender.web;

import java.util.Objects;

/**
 * JSON body of every failed rendering request.
 *
 * @param status always {@code "error"}
 * @param message what went wrong, safe to show to the caller
 * @param details exception summary for server failures, null for rejected requests
 */
public record ApiErrorResponse(String status, String message, String details) {

    static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(message, "Error message is required");
        status = status == null ? STATUS_ERROR : status;
    }

    static ApiErrorResponse rejected(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    static ApiErrorResponse failed(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
