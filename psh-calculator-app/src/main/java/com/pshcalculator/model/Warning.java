package com.pshcalculator.model;

public record Warning(
    WarningSeverity severity,
    String message
) {}
