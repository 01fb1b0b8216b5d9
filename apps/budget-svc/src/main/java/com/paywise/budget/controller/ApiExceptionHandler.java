package com.paywise.budget.controller;

import com.paywise.budget.analysis.AnalysisDataAccessException;
import com.paywise.budget.analysis.MissingPayScheduleException;
import com.paywise.budget.controller.dto.ErrorResponseDto;
import com.paywise.budget.web.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.time.format.DateTimeParseException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MissingPayScheduleException.class)
    public ResponseEntity<ErrorResponseDto> handleMissingSchedule(MissingPayScheduleException ex) {
        return build(HttpStatus.BAD_REQUEST, "PAY_SETTINGS_NOT_CONFIGURED", ex.getMessage(), Map.of(
                "action", "POST /pay-settings with lastPayDate and frequency"
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(DateTimeParseException.class)
    public ResponseEntity<ErrorResponseDto> handleDateParse(DateTimeParseException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Dates must use the YYYY-MM-DD format", Map.of(
                "value", ex.getParsedString()
        ));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid value for parameter '" + ex.getName() + "'", Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String message = fieldError != null && fieldError.getDefaultMessage() != null
                ? fieldError.getDefaultMessage()
                : "Request validation failed";
        Map<String, Object> details = fieldError != null ? Map.of("field", fieldError.getField()) : Map.of();
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, details);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(AnalysisDataAccessException.class)
    public ResponseEntity<ErrorResponseDto> handleDataAccess(AnalysisDataAccessException ex) {
        log.error("Analysis aborted on {}: {}", requestPath(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "ANALYSIS_DATA_UNAVAILABLE", "Failed to analyze overspending data", Map.of(
                "query", ex.getQuery()
        ));
    }

    @ExceptionHandler(CannotGetJdbcConnectionException.class)
    public ResponseEntity<ErrorResponseDto> handleJdbc(CannotGetJdbcConnectionException ex) {
        String specific = ex.getMostSpecificCause().getMessage();
        return build(HttpStatus.SERVICE_UNAVAILABLE, "DB_UNAVAILABLE", "Database temporarily unavailable", Map.of(
                "reason", specific != null ? specific : ex.getClass().getSimpleName()
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error on {}", requestPath(), ex);
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", Map.of("reason", reason));
    }

    private static String requestPath() {
        return RequestContextHolder.get().map(RequestContextHolder.RequestContext::path).orElse("unknown path");
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
