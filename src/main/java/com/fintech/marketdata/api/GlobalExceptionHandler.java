package com.fintech.marketdata.api;

import com.fintech.marketdata.service.MarketDataQueryService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle service layer validation errors.
     */
    @ExceptionHandler(MarketDataQueryService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            MarketDataQueryService.ValidationException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(
            HttpStatus.BAD_REQUEST, ErrorResponse.SERVICE_VALIDATION_ERROR, ex.getMessage(), path);

        log.warn("Service validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle service layer errors (storage failures, open circuit).
     */
    @ExceptionHandler(MarketDataQueryService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            MarketDataQueryService.ServiceException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(
            HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.SERVICE_ERROR, ex.getMessage(), path);

        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Handle validation constraint violations.
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getConstraintViolations().stream()
            .map(violation -> ErrorResponse.ValidationError.of(
                getFieldName(violation), violation.getInvalidValue(), violation.getMessage()))
            .collect(Collectors.toList());

        return validationFailed(request, validationErrors);
    }

    /**
     * Handle method parameter validation (Spring 6.1 built-in method validation).
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(
            HandlerMethodValidationException ex,
            WebRequest request) {

        List<ErrorResponse.ValidationError> validationErrors = ex.getAllValidationResults().stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(err -> ErrorResponse.ValidationError.of(
                    result.getMethodParameter().getParameterName(), result.getArgument(), err.getDefaultMessage())))
            .collect(Collectors.toList());

        return validationFailed(request, validationErrors);
    }

    /**
     * Handle missing required parameters.
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(
            HttpStatus.BAD_REQUEST,
            ErrorResponse.MISSING_PARAMETER,
            String.format("Required parameter '%s' is missing", ex.getParameterName()),
            path,
            List.of(new ErrorResponse.ValidationError(
                ex.getParameterName(),
                null,
                "This parameter is required"
            ))
        );

        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle type conversion errors (e.g., string instead of number).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ErrorResponse error = ErrorResponse.of(
            HttpStatus.BAD_REQUEST,
            ErrorResponse.TYPE_MISMATCH,
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType),
            path,
            List.of(ErrorResponse.ValidationError.of(
                ex.getName(), ex.getValue(), String.format("Expected type: %s", expectedType)))
        );

        log.warn("Type mismatch on {}: {} expected {} but got {}",
                path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(error);
    }

    /**
     * Handle all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(
            HttpStatus.INTERNAL_SERVER_ERROR,
            ErrorResponse.INTERNAL_ERROR,
            "An unexpected error occurred. Please contact support if this persists.",
            path
        );

        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> validationFailed(WebRequest request,
                                                          List<ErrorResponse.ValidationError> validationErrors) {
        String path = pathOf(request);
        ErrorResponse error = ErrorResponse.of(
            HttpStatus.BAD_REQUEST,
            ErrorResponse.VALIDATION_ERROR,
            "Request validation failed",
            path,
            validationErrors
        );

        log.warn("Validation error on {}: {}", path, validationErrors);
        return ResponseEntity.badRequest().body(error);
    }

    private static String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }

    /**
     * Extract field name from constraint violation.
     */
    private String getFieldName(ConstraintViolation<?> violation) {
        String propertyPath = violation.getPropertyPath().toString();
        int lastDot = propertyPath.lastIndexOf('.');
        return lastDot >= 0 ? propertyPath.substring(lastDot + 1) : propertyPath;
    }
}
