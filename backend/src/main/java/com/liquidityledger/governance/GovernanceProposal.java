package com.liquidityledger.governance;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Governance proposal with running tallies. Ballots are keyed by voter; one ballot per voter.
 */
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class GovernanceProposal {

    @EqualsAndHashCode.Include
    private String id;
    private String title;
    private String description;
    private String proposer;
    private Instant votingStart;
    private Instant votingEnd;
    private BigDecimal votesFor = BigDecimal.ZERO;
    private BigDecimal votesAgainst = BigDecimal.ZERO;
    private BigDecimal votesAbstain = BigDecimal.ZERO;
    private Map<String, Ballot> ballots = new LinkedHashMap<>();

    /** Voting is open from votingStart (inclusive) to votingEnd (exclusive). */
    public boolean isOpenAt(Instant time) {
        return !time.isBefore(votingStart) && time.isBefore(votingEnd);
    }

    public BigDecimal totalVotes() {
        return votesFor.add(votesAgainst).add(votesAbstain);
    }

    public GovernanceProposal snapshot() {
        GovernanceProposal copy = new GovernanceProposal();
        copy.id = id;
        copy.title = title;
        copy.description = description;
        copy.proposer = proposer;
        copy.votingStart = votingStart;
        copy.votingEnd = votingEnd;
        copy.votesFor = votesFor;
        copy.votesAgainst = votesAgainst;
        copy.votesAbstain = votesAbstain;
        copy.ballots = new LinkedHashMap<>(ballots);
        return copy;
    }
}
