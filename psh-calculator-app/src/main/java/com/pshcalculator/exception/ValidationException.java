package com.pshcalculator.exception;

import com.pshcalculator.model.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a calculation request fails validation. Carries every
 * violation found, not just the first.
 */
public class ValidationException extends RuntimeException {

    private final List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(describe(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("ValidationException requires at least one error");
        }
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String describe(List<ValidationError> errors) {
        return errors.stream()
            .map(e -> e.field() + ": " + e.message())
            .collect(Collectors.joining("; ", "Invalid calculation input: ", ""));
    }
}
