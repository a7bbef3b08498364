package com.pshcalculator.model;

import java.math.BigDecimal;

public record FinancialInput(
    BigDecimal rentToOwner,
    BigDecimal utilityAllowance,
    BigDecimal totalTenantPayment
) {}
