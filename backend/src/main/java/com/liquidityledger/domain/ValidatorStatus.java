package com.liquidityledger.domain;

public enum ValidatorStatus {
    ACTIVE,
    INACTIVE
}
