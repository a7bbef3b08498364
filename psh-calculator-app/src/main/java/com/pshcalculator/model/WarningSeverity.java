package com.pshcalculator.model;

public enum WarningSeverity {
    INFO,
    CAUTION,
    // Requires supervisor sign-off; never stops the calculation
    BLOCKING
}
