package com.pshcalculator.exception;

import com.pshcalculator.model.ConfigErrorCode;

/**
 * The FMR rate table is incomplete or holds an unusable value.
 * This is a setup problem, not a problem with the household's input.
 */
public class RateTableException extends RuntimeException {

    private final ConfigErrorCode code;

    public RateTableException(ConfigErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ConfigErrorCode getCode() {
        return code;
    }
}
