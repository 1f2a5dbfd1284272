package com.liquidityledger.governance;

public enum VoteChoice {
    FOR,
    AGAINST,
    ABSTAIN
}
