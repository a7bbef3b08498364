package com.pshcalculator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable mapping of bedroom size to rate. Edits produce a new table.
 * A table may be built incomplete (e.g. mid-import); see {@link #isComplete()}.
 */
public record FmrRateTable(
    LocalDate effectiveDate,
    Map<Integer, FmrRate> rates
) {
    public static final int MIN_BEDROOMS = 0;
    public static final int MAX_BEDROOMS = 5;

    public FmrRateTable {
        rates = rates == null
            ? Collections.emptySortedMap()
            : Collections.unmodifiableSortedMap(new TreeMap<>(rates));
    }

    public Optional<FmrRate> rateFor(int bedroomSize) {
        return Optional.ofNullable(rates.get(bedroomSize));
    }

    public FmrRateTable withRate(int bedroomSize, FmrRate rate) {
        Map<Integer, FmrRate> copy = new TreeMap<>(rates);
        copy.put(bedroomSize, rate);
        return new FmrRateTable(effectiveDate, copy);
    }

    @JsonIgnore
    public boolean isComplete() {
        for (int size = MIN_BEDROOMS; size <= MAX_BEDROOMS; size++) {
            if (!rates.containsKey(size)) return false;
        }
        return true;
    }

    public static boolean isValidBedroomSize(int size) {
        return size >= MIN_BEDROOMS && size <= MAX_BEDROOMS;
    }
}
