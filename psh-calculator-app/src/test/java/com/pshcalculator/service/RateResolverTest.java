package com.pshcalculator.service;

import com.pshcalculator.exception.RateTableException;
import com.pshcalculator.model.ConfigErrorCode;
import com.pshcalculator.model.FmrRate;
import com.pshcalculator.model.FmrRateTable;
import com.pshcalculator.model.Money;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateResolverTest {

    private final RateResolver resolver = new RateResolver();

    @Test
    void returnsRateForBedroomSize() {
        FmrRate rate = resolver.resolve(RateTables.defaults(), 2);

        assertThat(rate.fmr()).isEqualTo(Money.of(3604));
        assertThat(rate.paymentStandard()).isEqualTo(Money.of(3964));
    }

    @Test
    void failsWhenSizeIsMissing() {
        FmrRateTable partial = new FmrRateTable(RateTables.EFFECTIVE_DATE, Map.of(0, FmrRate.of(2734, 2485)));

        assertThatThrownBy(() -> resolver.resolve(partial, 4))
            .isInstanceOf(RateTableException.class)
            .hasMessageContaining("4-bedroom")
            .satisfies(e -> assertThat(((RateTableException) e).getCode()).isEqualTo(ConfigErrorCode.MISSING_RATE));
    }

    @Test
    void failsWhenValueIsNegative() {
        FmrRateTable corrupted = RateTables.defaults()
            .withRate(3, new FmrRate(new BigDecimal("5064"), new BigDecimal("-1")));

        assertThatThrownBy(() -> resolver.resolve(corrupted, 3))
            .isInstanceOf(RateTableException.class)
            .satisfies(e -> assertThat(((RateTableException) e).getCode()).isEqualTo(ConfigErrorCode.INVALID_RATE_VALUE));
    }

    @Test
    void failsWhenValueIsNull() {
        FmrRateTable corrupted = RateTables.defaults().withRate(1, new FmrRate(null, new BigDecimal("2977")));

        assertThatThrownBy(() -> resolver.resolve(corrupted, 1))
            .isInstanceOf(RateTableException.class)
            .satisfies(e -> assertThat(((RateTableException) e).getCode()).isEqualTo(ConfigErrorCode.INVALID_RATE_VALUE));
    }
}
