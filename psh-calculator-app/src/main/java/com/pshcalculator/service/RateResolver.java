package com.pshcalculator.service;

import com.pshcalculator.exception.RateTableException;
import com.pshcalculator.model.ConfigErrorCode;
import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import org.springframework.stereotype.Service;

@Service
public class RateResolver {

    /**
     * Look up the rate for a bedroom size. An installed table is always
     * complete, but a table passed in directly may not be.
     *
     * @throws RateTableException if the size has no entry or the entry is unusable
     */
    public FmrRate resolve(FmrRateTable table, int bedroomSize) {
        FmrRate rate = table.rateFor(bedroomSize)
            .orElseThrow(() -> new RateTableException(ConfigErrorCode.MISSING_RATE,
                "No FMR rate configured for " + bedroomSize + "-bedroom units"));

        if (!rate.isValid()) {
            throw new RateTableException(ConfigErrorCode.INVALID_RATE_VALUE,
                "FMR rate for " + bedroomSize + "-bedroom units is missing, negative or not in whole cents");
        }
        return rate;
    }
}
