package com.pshcalculator.model;

public enum ValidationErrorCode {
    MISSING_FIELD,
    INVALID_AMOUNT,
    OUT_OF_RANGE,
    INVALID_FAMILY_COMPOSITION
}
