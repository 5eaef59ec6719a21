package com.inventoryforecast.exception;

import com.inventoryforecast.dto.ForecastResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.UUID;

/**
 * Maps anything that escapes the controller to the failure envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String REQUEST_ID_HEADER = "X-Request-ID";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ForecastResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> problems = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "One or more fields failed validation",
                     "ValidationError", "VALIDATION_ERROR", problems, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ForecastResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable request body at {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Request body is not valid JSON for a forecast request",
                     PreparationException.class.getSimpleName(), "PREPARATION_ERROR",
                     List.of("Check data format and quality"), request);
    }

    @ExceptionHandler(UnsupportedBackendException.class)
    public ResponseEntity<ForecastResponse> handleUnsupportedBackend(
            UnsupportedBackendException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getClass().getSimpleName(),
                     ex.getErrorCode(), null, request);
    }

    @ExceptionHandler(ForecastException.class)
    public ResponseEntity<ForecastResponse> handleForecast(
            ForecastException ex, HttpServletRequest request) {
        log.warn("Forecast error at {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), ex.getClass().getSimpleName(),
                     ex.getErrorCode(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ForecastResponse> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred",
                     ex.getClass().getSimpleName(), "INTERNAL_ERROR", null, request);
    }

    private ResponseEntity<ForecastResponse> build(
            HttpStatus status, String error, String errorType, String errorCode,
            List<String> recommendations, HttpServletRequest request) {

        String header = request.getHeader(REQUEST_ID_HEADER);
        String requestId = header != null && !header.isBlank() ? header : UUID.randomUUID().toString();

        ForecastResponse body = ForecastResponse.builder()
            .success(false)
            .error(error)
            .errorType(errorType)
            .errorCode(errorCode)
            .recommendations(recommendations)
            .requestId(requestId)
            .build();

        return ResponseEntity.status(status).header(REQUEST_ID_HEADER, requestId).body(body);
    }
}
