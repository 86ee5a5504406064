package net.chapterone.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Builds the {@code {error, message}} body returned by {@link ApiExceptionHandler}.
 */
final class ErrorResponseUtils {

    private ErrorResponseUtils() {
    }

    static ResponseEntity<Map<String, String>> badRequest(String error, String message) {
        return respond(HttpStatus.BAD_REQUEST, error, message);
    }

    static ResponseEntity<Map<String, String>> notFound(String error, String message) {
        return respond(HttpStatus.NOT_FOUND, error, message);
    }

    static ResponseEntity<Map<String, String>> internalServerError(String error, String message) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, error, message);
    }

    // message is omitted when blank
    private static ResponseEntity<Map<String, String>> respond(HttpStatus status, String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        if (message != null && !message.isBlank()) {
            body.put("message", message);
        }
        return ResponseEntity.status(status).body(body);
    }
}
