package com.fintech.marketdata.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by the market data and storage endpoints.
 *
 * The {@code error} field carries one of the codes below; clients branch on it
 * rather than on the message text. Field-level problems (bad symbol, missing
 * or non-numeric range bound, limit out of range) are listed in
 * {@code validationErrors}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Failure of a market data query")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error code", example = "VALIDATION_ERROR",
            allowableValues = {"VALIDATION_ERROR", "SERVICE_VALIDATION_ERROR", "MISSING_PARAMETER",
                               "TYPE_MISMATCH", "SERVICE_ERROR", "INTERNAL_ERROR"})
    String error,

    @Schema(description = "Description of the failure", example = "Start time must be less than end time")
    String message,

    @Schema(description = "Request path", example = "/api/v1/market-data/trades")
    String path,

    @Schema(description = "When the failure was reported", example = "2024-03-01T10:00:00Z")
    Instant timestamp,

    @Schema(description = "Rejected request parameters, when the failure is a validation error")
    List<ValidationError> validationErrors
) {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String SERVICE_VALIDATION_ERROR = "SERVICE_VALIDATION_ERROR";
    public static final String MISSING_PARAMETER = "MISSING_PARAMETER";
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String SERVICE_ERROR = "SERVICE_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public static ErrorResponse of(HttpStatus status, String code, String message, String path) {
        return new ErrorResponse(status.value(), code, message, path, Instant.now(), null);
    }

    public static ErrorResponse of(HttpStatus status, String code, String message, String path,
                                   List<ValidationError> validationErrors) {
        return new ErrorResponse(status.value(), code, message, path, Instant.now(), validationErrors);
    }

    /**
     * One rejected request parameter.
     */
    @Schema(description = "Rejected request parameter")
    public record ValidationError(
        @Schema(description = "Parameter name", example = "symbol")
        String field,

        @Schema(description = "Value as received", example = "btcusdt")
        String rejectedValue,

        @Schema(description = "Constraint that was violated", example = "Symbol must be 3-20 uppercase alphanumeric characters")
        String message
    ) {

        public static ValidationError of(String field, Object rejectedValue, String message) {
            return new ValidationError(field, rejectedValue != null ? rejectedValue.toString() : "null", message);
        }
    }
}
