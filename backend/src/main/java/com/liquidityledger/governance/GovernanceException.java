package com.liquidityledger.governance;

import lombok.Getter;

/**
 * Thrown by GovernanceProposalService when a proposal or vote is rejected.
 */
@Getter
public class GovernanceException extends RuntimeException {

    public static final String PROPOSAL_NOT_FOUND = "PROPOSAL_NOT_FOUND";
    public static final String INVALID_PROPOSAL = "INVALID_PROPOSAL";
    public static final String INSUFFICIENT_GOVERNANCE_POWER = "INSUFFICIENT_GOVERNANCE_POWER";
    public static final String NO_VOTING_POWER = "NO_VOTING_POWER";
    public static final String ALREADY_VOTED = "ALREADY_VOTED";
    public static final String VOTING_CLOSED = "VOTING_CLOSED";

    private final String errorCode;

    public GovernanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
