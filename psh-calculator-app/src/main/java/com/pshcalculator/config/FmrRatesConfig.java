package com.pshcalculator.config;

import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default FMR rate table, used at startup and on reset-to-default.
 * Define rates in application.yml under 'psh.fmr.rates'
 */
@Configuration
@ConfigurationProperties(prefix = "psh.fmr")
public class FmrRatesConfig {

    private String effectiveDate = "2025-01-01";
    private List<RateDefinition> rates = new ArrayList<>();

    public String getEffectiveDate() {
        return effectiveDate;
    }

    public void setEffectiveDate(String effectiveDate) {
        this.effectiveDate = effectiveDate;
    }

    public List<RateDefinition> getRates() {
        return rates;
    }

    public void setRates(List<RateDefinition> rates) {
        this.rates = rates;
    }

    public FmrRateTable toTable() {
        Map<Integer, FmrRate> table = new LinkedHashMap<>();
        for (RateDefinition rate : rates) {
            table.put(rate.getBedrooms(), rate.toRate());
        }
        return new FmrRateTable(LocalDate.parse(effectiveDate), table);
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class RateDefinition {
        private Integer bedrooms;
        private BigDecimal paymentStandard;
        private BigDecimal fmr;

        public FmrRate toRate() {
            return new FmrRate(paymentStandard, fmr);
        }

        // Getters and setters for Spring Boot binding
        public Integer getBedrooms() { return bedrooms; }
        public void setBedrooms(Integer bedrooms) { this.bedrooms = bedrooms; }

        public BigDecimal getPaymentStandard() { return paymentStandard; }
        public void setPaymentStandard(BigDecimal paymentStandard) { this.paymentStandard = paymentStandard; }

        public BigDecimal getFmr() { return fmr; }
        public void setFmr(BigDecimal fmr) { this.fmr = fmr; }
    }
}
