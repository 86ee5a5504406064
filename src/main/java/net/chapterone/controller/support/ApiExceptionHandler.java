package net.chapterone.controller.support;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.exception.RecommendationCoreException;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.exception.ResourceNotFoundException;
import net.chapterone.util.LoggingUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps recommendation core exceptions onto HTTP statuses with the shared {@code {error, message}} body.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(RecommendationValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(RecommendationValidationException ex) {
        String error = ex.getField() == null ? "Invalid request" : "Invalid " + ex.getField();
        log.debug("Rejected request: {}", ex.getMessage());
        return ErrorResponseUtils.badRequest(error, ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ResourceNotFoundException ex) {
        return ErrorResponseUtils.notFound(ex.getResourceType() + " not found", ex.getMessage());
    }

    @ExceptionHandler(RecommendationCoreException.class)
    public ResponseEntity<Map<String, String>> handleCoreFailure(RecommendationCoreException ex) {
        LoggingUtils.error(log, ex, "Recommendation core failure");
        return ErrorResponseUtils.internalServerError("Recommendation core failure", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException ex) {
        LoggingUtils.error(log, ex, "Unhandled failure serving request");
        return ErrorResponseUtils.internalServerError("Internal error", ex.getMessage());
    }
}
