package com.pshcalculator.model;

public record ValidationError(
    ValidationErrorCode code,
    String field,      // dotted input path, e.g. "financial.rentToOwner"
    String message
) {}
