package com.pshcalculator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Subsidy determination for one household. Mixed-family fields
 * (proratedHap, prorationPercentage, mixedFamilyTenantRent) are null when
 * every member is eligible. audit echoes the request's sign-off block.
 */
public record CalculationResult(
    BigDecimal grossRent,
    BigDecimal effectiveTtp,
    BigDecimal totalHap,
    BigDecimal hapToOwner,
    BigDecimal tenantRent,
    BigDecimal utilityReimbursement,
    BigDecimal proratedHap,
    BigDecimal prorationPercentage,
    BigDecimal mixedFamilyTenantRent,
    int applicableBedroomSize,
    BigDecimal applicableFmr,
    BigDecimal applicablePaymentStandard,
    BigDecimal amountAboveFmr,
    boolean exceedsFmr,
    boolean mixedFamily,
    boolean ttpFloored,
    LocalDate rateTableEffectiveDate,
    List<Warning> warnings,
    AuditInfo audit
) {
    public CalculationResult {
        warnings = List.copyOf(warnings);
    }

    /**
     * HAP figure to pay the owner: the prorated amount for mixed families.
     */
    @JsonProperty
    public BigDecimal reportedHap() {
        return mixedFamily ? proratedHap : hapToOwner;
    }

    @JsonProperty
    public boolean requiresSupervisorApproval() {
        return warnings.stream().anyMatch(w -> w.severity() == WarningSeverity.BLOCKING);
    }
}
