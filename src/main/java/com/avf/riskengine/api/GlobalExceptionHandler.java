package com.avf.riskengine.api;

import com.avf.riskengine.api.dto.ApiError;
import com.avf.riskengine.domain.exception.FeatureShapeException;
import com.avf.riskengine.domain.exception.InputValidationException;
import com.avf.riskengine.domain.exception.NumericDomainException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiError.FieldIssue> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toIssue)
                .toList();
        return buildError(HttpStatus.BAD_REQUEST, "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "Malformed request body", List.of(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        List<ApiError.FieldIssue> details = List.of(ApiError.FieldIssue.builder()
                .field(ex.getName())
                .issue("Invalid value: " + ex.getValue())
                .build());
        return buildError(HttpStatus.BAD_REQUEST, "Invalid request parameter", details, request);
    }

    @ExceptionHandler(InputValidationException.class)
    public ResponseEntity<ApiError> handleInput(InputValidationException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(NumericDomainException.class)
    public ResponseEntity<ApiError> handleNumericDomain(NumericDomainException ex, HttpServletRequest request) {
        List<ApiError.FieldIssue> details = List.of(ApiError.FieldIssue.builder()
                .field(ex.getVariableName())
                .issue(ex.getMessage())
                .build());
        return buildError(HttpStatus.UNPROCESSABLE_ENTITY, "Prediction failed", details, request);
    }

    @ExceptionHandler(FeatureShapeException.class)
    public ResponseEntity<ApiError> handleFeatureShape(FeatureShapeException ex, HttpServletRequest request) {
        log.error("[API] 피처 정렬 오류: {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "Model artifacts are misaligned", List.of(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("[API] 처리되지 않은 예외: {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", List.of(), request);
    }

    private ApiError.FieldIssue toIssue(FieldError error) {
        return ApiError.FieldIssue.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String message, List<ApiError.FieldIssue> details,
                                                HttpServletRequest request) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details(details)
                .build();
        log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        return ResponseEntity.status(status).body(error);
    }
}
