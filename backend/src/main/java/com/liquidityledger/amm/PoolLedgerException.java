package com.liquidityledger.amm;

import lombok.Getter;

/**
 * Thrown by PoolLedger and PositionTracker when a request is invalid or a pool rule is violated.
 * The pool is left unchanged.
 */
@Getter
public class PoolLedgerException extends RuntimeException {

    public static final String POOL_NOT_FOUND = "POOL_NOT_FOUND";
    public static final String INVALID_POOL = "INVALID_POOL";
    public static final String INVALID_TOKEN = "INVALID_TOKEN";
    public static final String POOL_INACTIVE = "POOL_INACTIVE";
    public static final String UNKNOWN_TOKEN = "UNKNOWN_TOKEN";
    public static final String UNKNOWN_TOKEN_PAIR = "UNKNOWN_TOKEN_PAIR";
    public static final String INVALID_AMOUNT = "INVALID_AMOUNT";
    public static final String ZERO_LIQUIDITY_MINTED = "ZERO_LIQUIDITY_MINTED";
    public static final String INSUFFICIENT_LP = "INSUFFICIENT_LP";
    public static final String POSITION_NOT_FOUND = "POSITION_NOT_FOUND";
    public static final String POSITION_CLOSED = "POSITION_CLOSED";
    public static final String PRICE_IMPACT_EXCEEDED = "PRICE_IMPACT_EXCEEDED";
    public static final String SLIPPAGE_EXCEEDED = "SLIPPAGE_EXCEEDED";
    public static final String INSUFFICIENT_RESERVES = "INSUFFICIENT_RESERVES";
    public static final String INVALID_STATUS_TRANSITION = "INVALID_STATUS_TRANSITION";

    private final String errorCode;

    public PoolLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
