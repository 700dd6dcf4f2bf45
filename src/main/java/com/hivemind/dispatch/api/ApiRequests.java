package com.hivemind.dispatch.api;

/**
 * Request-body checks shared by the controllers. Failures surface as 400 via {@link ApiExceptionHandler}.
 */
final class ApiRequests {

    private ApiRequests() {}

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
