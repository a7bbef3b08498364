package com.pshcalculator.model;

/**
 * Raw input as received from a form or API client. Any part may be null
 * until it has been through the validator; audit is optional.
 */
public record CalculationRequest(
    HouseholdInput household,
    FinancialInput financial,
    FamilyComposition family,
    AuditInfo audit
) {}
