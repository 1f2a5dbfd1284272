package com.liquidityledger.domain;

public enum PositionType {
    LIQUIDITY,
    STAKE,
    DELEGATION
}
