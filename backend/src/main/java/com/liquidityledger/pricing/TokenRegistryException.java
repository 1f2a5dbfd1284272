package com.liquidityledger.pricing;

import lombok.Getter;

/**
 * Thrown by TokenRegistry when a token is unknown or its metadata is invalid.
 */
@Getter
public class TokenRegistryException extends RuntimeException {

    public static final String INVALID_TOKEN = "INVALID_TOKEN";

    /** Error code: INVALID_TOKEN. */
    private final String errorCode;

    public TokenRegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
