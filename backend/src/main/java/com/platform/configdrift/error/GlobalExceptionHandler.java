package com.platform.configdrift.error;

import com.platform.configdrift.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Converts exceptions escaping the drift API into ErrorResponse bodies.
 *
 * RULES:
 * - Never swallow exceptions (always log)
 * - Never return HTTP 200 on failure
 * - Always include the CD error code
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), request.getRequestURI(), traceId);
        if (ex.getField() != null) {
            response.setFieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(FetchFailureException.class)
    public ResponseEntity<ErrorResponse> handleFetchFailure(
            FetchFailureException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] Fetch from {} failed for {}: {}", 
            traceId, ex.getSource(), ex.getResource(), ex.getMessage());
        recordMetric(ex.getErrorCode());

        ErrorResponse response = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), request.getRequestURI(), traceId);
        response.setMetadata(Map.of("source", ex.getSource(), "resource", String.valueOf(ex.getResource())));

        return ResponseEntity.status(ex.getErrorCode().getHttpStatus()).body(response);
    }

    @ExceptionHandler(DriftMonitorException.class)
    public ResponseEntity<ErrorResponse> handleDriftMonitorException(
            DriftMonitorException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();

        if (ex.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);

        ErrorResponse response = ErrorResponse.of(errorCode, ex.getMessage(), request.getRequestURI(), traceId);
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }

    // ==================== Request Errors ====================

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .collect(Collectors.toList());

        log.warn("[{}] Request validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Validation failed", request.getRequestURI(), traceId);
        response.setFieldErrors(fieldErrors);

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.VALIDATION_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.VALIDATION_ERROR, "Invalid request body", request.getRequestURI(), traceId);
        response.setDetail(ex.getMostSpecificCause().getMessage());

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);

        String message = String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue());
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_FIELD_VALUE, message, request.getRequestURI(), traceId);

        return ResponseEntity.badRequest().body(response);
    }

    // ==================== Catch-All ====================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(
            Exception ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();

        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);

        ErrorResponse response = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR, "An unexpected error occurred", request.getRequestURI(), traceId);
        response.setDetail(ex.getClass().getSimpleName());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }

    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.recordError(errorCode);
    }
}
