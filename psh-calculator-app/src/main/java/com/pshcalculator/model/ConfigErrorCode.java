package com.pshcalculator.model;

public enum ConfigErrorCode {
    MISSING_RATE,
    INVALID_RATE_VALUE
}
