package com.pshcalculator.controller;

import com.pshcalculator.exception.RateTableException;
import com.pshcalculator.exception.ValidationException;
import com.pshcalculator.model.ConfigErrorCode;
import com.pshcalculator.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Maps engine failures to HTTP responses. Validation problems are the
 * caller's to fix (400, every field listed); rate table problems are a
 * setup issue (409) and are reported separately from calculation input.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponseBody> handleValidation(ValidationException ex) {
        log.warn("Rejected calculation input: {} error(s)", ex.getErrors().size());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponseBody("VALIDATION_ERROR", "One or more fields are invalid", null, ex.getErrors()));
    }

    @ExceptionHandler(RateTableException.class)
    public ResponseEntity<ErrorResponseBody> handleRateTable(RateTableException ex) {
        log.error("FMR rate table problem ({}): {}", ex.getCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponseBody("CONFIG_ERROR", ex.getMessage(), ex.getCode(), List.of()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseBody> handleMalformed(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponseBody("MALFORMED_REQUEST", "Request body or parameters could not be read", null, List.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseBody> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            log.warn("Request failed with {}: {}", status, ex.getMessage());
            return ResponseEntity.status(status)
                .body(new ErrorResponseBody("REQUEST_ERROR", ex.getMessage(), null, List.of()));
        }
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponseBody("INTERNAL_ERROR", "An unexpected error occurred", null, List.of()));
    }

    record ErrorResponseBody(String code, String message, ConfigErrorCode configCode, List<ValidationError> errors) {}
}
