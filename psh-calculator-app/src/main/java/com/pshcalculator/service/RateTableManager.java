package com.pshcalculator.service;

import com.pshcalculator.config.FmrRatesConfig;
import com.pshcalculator.exception.RateTableException;
import com.pshcalculator.model.ConfigErrorCode;
import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active FMR rate table.
 *
 * Tables are immutable; every change installs a new table by swapping the
 * reference, so a calculation sees the table as it was before or after an
 * edit and never a mix. Nothing is installed unless it covers every
 * bedroom size with valid amounts.
 */
@Service
public class RateTableManager {

    private static final Logger log = LoggerFactory.getLogger(RateTableManager.class);

    private final FmrRatesConfig defaults;
    private final RateTableCsvParser csvParser;
    private final AtomicReference<FmrRateTable> active;

    public RateTableManager(FmrRatesConfig defaults, RateTableCsvParser csvParser) {
        this.defaults = defaults;
        this.csvParser = csvParser;
        FmrRateTable initial = defaults.toTable();
        checkInstallable(initial);
        this.active = new AtomicReference<>(initial);
        log.info("Loaded default FMR rate table effective {}", initial.effectiveDate());
    }

    public FmrRateTable current() {
        return active.get();
    }

    /**
     * Replace the whole table, e.g. after an import.
     *
     * @throws RateTableException if the table is incomplete or holds invalid values;
     *                            the active table is left unchanged
     */
    public FmrRateTable replace(FmrRateTable table) {
        checkInstallable(table);
        active.set(table);
        log.info("Installed FMR rate table effective {}", table.effectiveDate());
        return table;
    }

    public FmrRateTable resetToDefault() {
        FmrRateTable table = defaults.toTable();
        checkInstallable(table);
        active.set(table);
        log.info("Reset FMR rate table to defaults effective {}", table.effectiveDate());
        return table;
    }

    /**
     * Edit a single bedroom size's rate.
     */
    public FmrRateTable updateRate(int bedroomSize, FmrRate rate) {
        checkBedroomSize(bedroomSize);
        checkRate(bedroomSize, rate);
        FmrRateTable updated = active.updateAndGet(table -> table.withRate(bedroomSize, rate));
        log.info("Updated {}-bedroom FMR rate: payment standard {}, FMR {}",
            bedroomSize, rate.paymentStandard(), rate.fmr());
        return updated;
    }

    /**
     * Replace the whole table from CSV (bedrooms,payment_standard,fmr).
     */
    public FmrRateTable importCsv(Reader csv, LocalDate effectiveDate) throws IOException {
        return replace(csvParser.parse(csv, effectiveDate));
    }

    private static void checkInstallable(FmrRateTable table) {
        if (table == null) {
            throw new RateTableException(ConfigErrorCode.MISSING_RATE, "Rate table is required");
        }
        if (table.effectiveDate() == null) {
            throw new RateTableException(ConfigErrorCode.INVALID_RATE_VALUE, "Rate table effective date is required");
        }
        for (Map.Entry<Integer, FmrRate> entry : table.rates().entrySet()) {
            checkBedroomSize(entry.getKey());
            checkRate(entry.getKey(), entry.getValue());
        }
        for (int size = FmrRateTable.MIN_BEDROOMS; size <= FmrRateTable.MAX_BEDROOMS; size++) {
            if (table.rateFor(size).isEmpty()) {
                throw new RateTableException(ConfigErrorCode.MISSING_RATE,
                    "Rate table has no entry for " + size + "-bedroom units");
            }
        }
    }

    private static void checkBedroomSize(Integer bedroomSize) {
        if (bedroomSize == null || !FmrRateTable.isValidBedroomSize(bedroomSize)) {
            throw new RateTableException(ConfigErrorCode.MISSING_RATE,
                "Bedroom size " + bedroomSize + " is outside " + FmrRateTable.MIN_BEDROOMS
                    + "-" + FmrRateTable.MAX_BEDROOMS);
        }
    }

    private static void checkRate(int bedroomSize, FmrRate rate) {
        if (rate == null || !rate.isValid()) {
            throw new RateTableException(ConfigErrorCode.INVALID_RATE_VALUE,
                "Rate for " + bedroomSize + "-bedroom units must be a non-negative amount in whole cents");
        }
    }
}
