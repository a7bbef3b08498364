package com.pshcalculator.service;

import com.pshcalculator.model.CalculationRequest;
import com.pshcalculator.model.CalculationResult;
import com.pshcalculator.model.FmrRateTable;
import com.pshcalculator.model.ValidatedRequest;
import com.pshcalculator.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for forms and exporters: validate, then calculate against
 * the active rate table.
 */
@Service
public class CalculationService {

    private static final Logger log = LoggerFactory.getLogger(CalculationService.class);

    private final InputValidator validator;
    private final RentCalculator calculator;
    private final RateTableManager rateTableManager;

    public CalculationService(InputValidator validator,
                              RentCalculator calculator,
                              RateTableManager rateTableManager) {
        this.validator = validator;
        this.calculator = calculator;
        this.rateTableManager = rateTableManager;
    }

    public List<ValidationError> check(CalculationRequest request) {
        return validator.check(request);
    }

    public ValidatedRequest validate(CalculationRequest request) {
        return validator.validate(request);
    }

    /**
     * Calculate against a snapshot of the active rate table.
     */
    public CalculationResult calculate(ValidatedRequest request) {
        return calculate(request, rateTableManager.current());
    }

    public CalculationResult calculate(ValidatedRequest request, FmrRateTable rateTable) {
        CalculationResult result = calculator.calculate(request, rateTable);

        // Head of household name stays out of the logs
        log.info("Calculated {}-bedroom determination: HAP {}, tenant rent {}, mixed family {}",
            result.applicableBedroomSize(), result.reportedHap(), result.tenantRent(), result.mixedFamily());
        if (result.exceedsFmr()) {
            log.warn("Gross rent {} exceeds {}-bedroom FMR {}; supervisor approval required",
                result.grossRent(), result.applicableBedroomSize(), result.applicableFmr());
        }
        return result;
    }

    public CalculationResult validateAndCalculate(CalculationRequest request) {
        return calculate(validate(request));
    }
}
