package com.liquidityledger.validator;

import lombok.Getter;

/**
 * Thrown by ValidatorRegistry when a validator is unknown, ineligible or a slash request is invalid.
 */
@Getter
public class ValidatorRegistryException extends RuntimeException {

    public static final String VALIDATOR_NOT_FOUND = "VALIDATOR_NOT_FOUND";
    public static final String VALIDATOR_INACTIVE = "VALIDATOR_INACTIVE";
    public static final String INVALID_VALIDATOR = "INVALID_VALIDATOR";
    public static final String BELOW_MINIMUM_STAKE = "BELOW_MINIMUM_STAKE";
    public static final String COMMISSION_TOO_HIGH = "COMMISSION_TOO_HIGH";
    public static final String INVALID_PENALTY = "INVALID_PENALTY";

    private final String errorCode;

    public ValidatorRegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
