package com.pshcalculator.service;

import com.pshcalculator.exception.RateTableException;
import com.pshcalculator.model.ConfigErrorCode;
import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads an FMR rate table from CSV in the worksheet's layout:
 * <pre>
 * bedrooms,payment_standard,fmr
 * 0,2734,2485
 * </pre>
 * Completeness is not checked here; the rate table manager does that on install.
 */
@Service
public class RateTableCsvParser {

    static final String HEADER = "bedrooms,payment_standard,fmr";

    public FmrRateTable parse(Reader source, LocalDate effectiveDate) throws IOException {
        BufferedReader reader = new BufferedReader(source);
        Map<Integer, FmrRate> rates = new TreeMap<>();
        boolean headerSeen = false;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (trimmed.isEmpty()) continue;

            if (!headerSeen) {
                if (!HEADER.equalsIgnoreCase(trimmed.replace(" ", ""))) {
                    throw invalid(lineNumber, "expected header '" + HEADER + "'");
                }
                headerSeen = true;
                continue;
            }

            String[] cells = trimmed.split(",", -1);
            if (cells.length != 3) {
                throw invalid(lineNumber, "expected 3 columns but found " + cells.length);
            }

            int bedrooms = parseBedrooms(cells[0].strip(), lineNumber);
            if (rates.containsKey(bedrooms)) {
                throw invalid(lineNumber, "duplicate entry for " + bedrooms + " bedrooms");
            }
            rates.put(bedrooms, new FmrRate(
                parseAmount(cells[1].strip(), lineNumber),
                parseAmount(cells[2].strip(), lineNumber)
            ));
        }

        if (!headerSeen) {
            throw new RateTableException(ConfigErrorCode.MISSING_RATE, "Rate table CSV is empty");
        }
        return new FmrRateTable(effectiveDate, rates);
    }

    private static int parseBedrooms(String cell, int lineNumber) {
        try {
            return Integer.parseInt(cell);
        } catch (NumberFormatException e) {
            throw invalid(lineNumber, "bedrooms '" + cell + "' is not a whole number");
        }
    }

    private static BigDecimal parseAmount(String cell, int lineNumber) {
        try {
            return new BigDecimal(cell);
        } catch (NumberFormatException e) {
            throw invalid(lineNumber, "'" + cell + "' is not a valid amount");
        }
    }

    private static RateTableException invalid(int lineNumber, String detail) {
        return new RateTableException(ConfigErrorCode.INVALID_RATE_VALUE,
            "Rate table CSV line " + lineNumber + ": " + detail);
    }
}
