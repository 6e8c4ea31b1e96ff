package com.di.geoingest.exception;

import com.di.geoingest.config.MdcRequestFilter;
import com.di.geoingest.load.TableVisibilityTimeoutException;
import com.di.geoingest.source.SourceOpenException;
import com.di.geoingest.warehouse.WarehouseException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a structured {@link ErrorResponse}, categorized with
 * {@link ErrorCategory}.
 *
 * <table border="1">
 * <tr><th>Exception</th><th>Status</th></tr>
 * <tr><td>{@link SourceOpenException}</td><td>422</td></tr>
 * <tr><td>{@link TableVisibilityTimeoutException}</td><td>504</td></tr>
 * <tr><td>{@link WarehouseException}</td><td>502</td></tr>
 * <tr><td>bean validation, {@link IllegalArgumentException}, {@link IllegalStateException}</td><td>400</td></tr>
 * <tr><td>anything else</td><td>500</td></tr>
 * </table>
 *
 * Load jobs that were interrupted mid-run are not exceptions here: they come back as a ledger
 * row from the controller.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SourceOpenException.class)
    public ResponseEntity<ErrorResponse> handleSourceOpen(SourceOpenException e) {
        return respond("SOURCE_EXCEPTION", e, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(TableVisibilityTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleVisibilityTimeout(TableVisibilityTimeoutException e) {
        ResponseEntity<ErrorResponse> response = respond("TABLE_VISIBILITY_TIMEOUT", e, HttpStatus.GATEWAY_TIMEOUT);
        response.getBody().addDetail("table", String.valueOf(e.getTable()));
        response.getBody().addDetail("attempts", e.getAttempts());
        return response;
    }

    @ExceptionHandler(WarehouseException.class)
    public ResponseEntity<ErrorResponse> handleWarehouse(WarehouseException e) {
        return respond("WAREHOUSE_EXCEPTION", e, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        ResponseEntity<ErrorResponse> response = respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            response.getBody().addDetail(error.getField(), error.getDefaultMessage());
        }
        response.getBody().setMessage("Request validation failed");
        return response;
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleValidation(RuntimeException e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable exception, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        if (status.is5xxServerError()) {
            log.error("[{}] {} [{}]: {}", eventType, exception.getClass().getSimpleName(),
                    category.getName(), exception.getMessage(), exception);
        } else {
            log.warn("[{}] {} [{}]: {}", eventType, exception.getClass().getSimpleName(),
                    category.getName(), exception.getMessage());
        }
        return ResponseEntity.status(status).body(buildErrorResponse(category, exception, status));
    }

    static ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setErrorCategoryDescription(category.getDescription());
        response.setRequestId(MDC.get(MdcRequestFilter.REQUEST_ID));
        String path = MDC.get(MdcRequestFilter.REQUEST_PATH);
        response.setPath(path != null ? path : "/unknown");
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String errorCategoryDescription;
        private String requestId;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
