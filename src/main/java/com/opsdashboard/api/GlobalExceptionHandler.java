package com.opsdashboard.api;

import com.opsdashboard.config.DashboardProperties;
import com.opsdashboard.domain.exception.QueryExecutionException;
import com.opsdashboard.domain.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final DashboardProperties properties;

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> response = errorBody(HttpStatus.BAD_REQUEST, ex.getMessage());
        response.put("kind", ex.getKind().name());
        response.put("field", ex.getField());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        Map<String, Object> response = errorBody(HttpStatus.BAD_REQUEST,
                "Invalid value '" + ex.getValue() + "' for parameter " + ex.getName());
        response.put("field", ex.getName());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleQueryExecution(QueryExecutionException ex) {
        HttpStatus status = ex.getKind() == QueryExecutionException.Kind.STORE_UNAVAILABLE
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("Query execution failed ({})", ex.getKind(), ex);

        Map<String, Object> response = errorBody(status, ex.getMessage());
        response.put("kind", ex.getKind().name());
        return ResponseEntity.status(status).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        // Details only leave the service in debug mode
        String message = properties.isDebug() ? ex.toString() : "An unexpected error occurred";
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, message));
    }

    private Map<String, Object> errorBody(HttpStatus status, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status", status.value());
        response.put("error", status.getReasonPhrase());
        response.put("message", message);
        return response;
    }
}
