package com.example.logstore.config;

import com.example.logstore.exceptions.ErrorCode;
import com.example.logstore.exceptions.LogStoreException;
import com.example.logstore.logs.DTOs.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to the response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LogStoreException.class)
    public ResponseEntity<ApiResponse<Void>> handleLogStoreException(LogStoreException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToHttpStatus(errorCode);

        String message;
        if (status.is5xxServerError()) {
            log.error("Log store failure: {} - {}", errorCode, ex.getMessage());
            message = errorCode.getDescription();
        } else {
            log.debug("Rejected request: {} - {}", errorCode, ex.getMessage());
            message = ex.getMessage();
        }

        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), errorCode.getCode(), errorCode.name(), message, null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return validationFailure(errors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleMethodValidation(HandlerMethodValidationException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getParameterValidationResults().forEach(result -> result.getResolvableErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError
                    ? fieldError.getField()
                    : result.getMethodParameter().getParameterName();
            errors.putIfAbsent(field, error.getDefaultMessage());
        }));
        return validationFailure(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(400, null, "BAD_REQUEST", "Invalid JSON format", null));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(400, null, "BAD_REQUEST", "Invalid value for parameter " + ex.getName(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            return ResponseEntity.status(status)
                    .body(ApiResponse.error(status.value(), null, String.valueOf(status.value()),
                            errorResponse.getBody().getDetail(), null));
        }

        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(500, ErrorCode.UNKNOWN_ERROR.getCode(), "INTERNAL_ERROR",
                        "Internal server error", null));
    }

    private ResponseEntity<ApiResponse<Map<String, String>>> validationFailure(Map<String, String> errors) {
        log.debug("Validation failed: {}", errors);
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(400, null, "VALIDATION_FAILED", "Validation failed", errors));
    }

    private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case SEGMENT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case SEGMENT_ACTIVE -> HttpStatus.CONFLICT;
            case SEGMENT_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> errorCode.isClientError() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
