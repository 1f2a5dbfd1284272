package com.liquidityledger.staking;

import lombok.Getter;

/**
 * Thrown by StakingLedger when a request is invalid or a staking rule is violated. No state is changed.
 */
@Getter
public class StakingLedgerException extends RuntimeException {

    public static final String POOL_NOT_FOUND = "POOL_NOT_FOUND";
    public static final String INVALID_POOL = "INVALID_POOL";
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String POOL_INACTIVE = "POOL_INACTIVE";
    public static final String STAKE_OUT_OF_BOUNDS = "STAKE_OUT_OF_BOUNDS";
    public static final String STAKE_NOT_FOUND = "STAKE_NOT_FOUND";
    public static final String STAKE_NOT_ACTIVE = "STAKE_NOT_ACTIVE";
    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String EXCEEDS_STAKED = "EXCEEDS_STAKED";
    public static final String STILL_BONDED = "STILL_BONDED";

    private final String errorCode;

    public StakingLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
