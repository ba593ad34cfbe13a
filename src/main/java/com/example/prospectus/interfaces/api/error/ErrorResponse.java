package com.example.prospectus.interfaces.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint. {@code error} is a stable machine-readable code such as
 * {@code DOCUMENT_NOT_FOUND}; {@code details} is omitted unless the failure names the offending input.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, String> details
) {

    public ErrorResponse {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * @param status  response status
     * @param error   stable error code
     * @param message human readable explanation
     * @param path    request path that produced the error
     * @return error body stamped with the current time
     */
    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status.value(), error, message, path, Map.of());
    }

    public ErrorResponse withDetail(String name, String value) {
        if (value == null) {
            return this;
        }
        return new ErrorResponse(timestamp, status, error, message, path, Map.of(name, value));
    }
}
