package com.pshcalculator.model;

/**
 * Input that has passed validation: all fields present, amounts at scale 2,
 * bedroom sizes in range and at least one household member.
 */
public record ValidatedRequest(
    HouseholdInput household,
    FinancialInput financial,
    FamilyComposition family,
    AuditInfo audit
) {}
