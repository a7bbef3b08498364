package com.pshcalculator.model;

public record HouseholdInput(
    String headOfHouseholdName,
    Integer voucherBedroomSize,
    Integer unitBedrooms
) {
    // HUD rule: the lesser of voucher size and unit size governs the FMR lookup
    public int applicableBedroomSize() {
        return Math.min(voucherBedroomSize, unitBedrooms);
    }
}
