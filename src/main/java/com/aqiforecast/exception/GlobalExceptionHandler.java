package com.aqiforecast.exception;

import com.aqiforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_FAILED", fieldErrors, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", ex.getMessage(),
                     request, "VALIDATION_FAILED", null, null);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        String msg = ex instanceof MethodArgumentTypeMismatchException mismatch
            ? String.format("Parameter '%s' should be of type %s", mismatch.getName(),
                mismatch.getRequiredType() != null ? mismatch.getRequiredType().getSimpleName() : "unknown")
            : "Malformed request body";
        return build(HttpStatus.BAD_REQUEST, "Bad Request", msg, request, "BAD_REQUEST", null, null);
    }

    @ExceptionHandler({UnknownModelException.class, VersionNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(
            AqiForecastException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ApiError> handleConflict(
            ConcurrencyConflictException ex, HttpServletRequest request) {
        Map<String, Object> details = ex.getQueuedTriggerId() != null
            ? Map.of("predictorId", ex.getPredictorId(), "queuedTriggerId", ex.getQueuedTriggerId())
            : Map.of("predictorId", ex.getPredictorId());
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(),
                     request, ex.getErrorCode(), null, details);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficientData(
            InsufficientDataException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Data", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(ConfigurationValidationException.class)
    public ResponseEntity<ApiError> handleConfiguration(
            ConfigurationValidationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Configuration", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler({PersistenceException.class, PredictorUnavailableException.class})
    public ResponseEntity<ApiError> handleUnavailable(
            AqiForecastException ex, HttpServletRequest request) {
        log.error("Dependency unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(PredictorException.class)
    public ResponseEntity<ApiError> handlePredictorError(
            PredictorException ex, HttpServletRequest request) {
        log.error("Predictor error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Predictor Error",
                     ex.getMessage(), request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(AqiForecastException.class)
    public ResponseEntity<ApiError> handleDomain(
            AqiForecastException ex, HttpServletRequest request) {
        log.warn("Request failed at {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable", ex.getMessage(),
                     request, ex.getErrorCode(), null, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors, Map<String, Object> details) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .details(details)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
