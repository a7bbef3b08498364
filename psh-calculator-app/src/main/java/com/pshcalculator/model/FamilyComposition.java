package com.pshcalculator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record FamilyComposition(
    Integer eligibleMembers,
    Integer ineligibleMembers
) {
    public long totalMembers() {
        return (long) eligibleMembers + ineligibleMembers;
    }

    @JsonIgnore
    public boolean isMixedFamily() {
        return ineligibleMembers > 0;
    }
}
