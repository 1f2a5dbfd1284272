package com.liquidityledger.governance;

import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.governance.config.GovernanceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Governance proposals and voting. Proposers need the configured voting power; ballots are weighted by the
 * voter's power at the time of voting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernanceProposalService {

    private final Map<String, GovernanceProposal> proposals = new ConcurrentHashMap<>();

    private final GovernanceTally governanceTally;
    private final EntityLocks locks;
    private final GovernanceProperties governanceProperties;
    private final Clock clock;

    /**
     * Open a proposal; voting starts now.
     *
     * @param id         proposal id, or null to generate one
     * @param votingDays window length, configured default when null
     * @throws GovernanceException INSUFFICIENT_GOVERNANCE_POWER, INVALID_PROPOSAL
     */
    public GovernanceProposal createProposal(String id, String title, String description, String proposer,
                                             Integer votingDays) {
        if (title == null || title.isBlank()) {
            throw new GovernanceException(GovernanceException.INVALID_PROPOSAL, "Title is required");
        }
        int days = votingDays != null ? votingDays : governanceProperties.getDefaultVotingDays();
        if (days <= 0) {
            throw new GovernanceException(GovernanceException.INVALID_PROPOSAL, "Voting days must be positive: " + days);
        }
        BigDecimal power = governanceTally.votingPower(proposer);
        if (power.compareTo(governanceProperties.getProposalThreshold()) < 0) {
            throw new GovernanceException(GovernanceException.INSUFFICIENT_GOVERNANCE_POWER,
                    "Proposer " + proposer + " has " + power + ", needs " + governanceProperties.getProposalThreshold());
        }
        Instant now = Instant.now(clock);
        GovernanceProposal proposal = new GovernanceProposal();
        proposal.setId(id != null ? id : UUID.randomUUID().toString());
        proposal.setTitle(title);
        proposal.setDescription(description);
        proposal.setProposer(proposer);
        proposal.setVotingStart(now);
        proposal.setVotingEnd(now.plus(Duration.ofDays(days)));
        if (proposals.putIfAbsent(proposal.getId(), proposal) != null) {
            throw new GovernanceException(GovernanceException.INVALID_PROPOSAL,
                    "Proposal already exists: " + proposal.getId());
        }
        log.info("Proposal {} '{}' opened by {} until {}", proposal.getId(), title, proposer, proposal.getVotingEnd());
        return locks.withLock(EntityLocks.proposal(proposal.getId()), proposal::snapshot);
    }

    /**
     * Cast a ballot weighted by the voter's current governance power.
     *
     * @throws GovernanceException PROPOSAL_NOT_FOUND, VOTING_CLOSED, NO_VOTING_POWER, ALREADY_VOTED
     */
    public GovernanceProposal vote(String proposalId, String voter, VoteChoice choice) {
        if (choice == null) {
            throw new GovernanceException(GovernanceException.INVALID_PROPOSAL, "Vote choice is required");
        }
        GovernanceProposal proposal = require(proposalId);
        BigDecimal weight = governanceTally.votingPower(voter);

        GovernanceProposal snapshot = locks.withLock(EntityLocks.proposal(proposalId), () -> {
            Instant now = Instant.now(clock);
            if (!proposal.isOpenAt(now)) {
                throw new GovernanceException(GovernanceException.VOTING_CLOSED,
                        "Voting on " + proposalId + " ended at " + proposal.getVotingEnd());
            }
            if (weight.signum() <= 0) {
                throw new GovernanceException(GovernanceException.NO_VOTING_POWER, "Voter " + voter + " has no voting power");
            }
            if (proposal.getBallots().containsKey(voter)) {
                throw new GovernanceException(GovernanceException.ALREADY_VOTED,
                        "Voter " + voter + " already voted on " + proposalId);
            }
            proposal.getBallots().put(voter, new Ballot(voter, choice, weight, now));
            switch (choice) {
                case FOR -> proposal.setVotesFor(proposal.getVotesFor().add(weight));
                case AGAINST -> proposal.setVotesAgainst(proposal.getVotesAgainst().add(weight));
                case ABSTAIN -> proposal.setVotesAbstain(proposal.getVotesAbstain().add(weight));
            }
            return proposal.snapshot();
        });

        log.info("Voter {} voted {} on proposal {} with weight {}", voter, choice, proposalId, weight);
        return snapshot;
    }

    public GovernanceProposal getProposal(String proposalId) {
        GovernanceProposal proposal = require(proposalId);
        return locks.withLock(EntityLocks.proposal(proposalId), proposal::snapshot);
    }

    public List<GovernanceProposal> listProposals() {
        List<GovernanceProposal> result = new ArrayList<>();
        for (GovernanceProposal proposal : proposals.values()) {
            result.add(locks.withLock(EntityLocks.proposal(proposal.getId()), proposal::snapshot));
        }
        result.sort(Comparator.comparing(GovernanceProposal::getVotingStart).thenComparing(GovernanceProposal::getId));
        return result;
    }

    private GovernanceProposal require(String proposalId) {
        GovernanceProposal proposal = proposalId == null ? null : proposals.get(proposalId);
        if (proposal == null) {
            throw new GovernanceException(GovernanceException.PROPOSAL_NOT_FOUND, "Proposal not found: " + proposalId);
        }
        return proposal;
    }
}
