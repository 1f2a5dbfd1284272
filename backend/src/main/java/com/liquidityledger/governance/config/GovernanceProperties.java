package com.liquidityledger.governance.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

@ConfigurationProperties(prefix = "liquidityledger.governance")
@NoArgsConstructor
@Getter
@Setter
public class GovernanceProperties {

    /** Voting power a proposer needs to open a proposal. */
    private BigDecimal proposalThreshold = new BigDecimal("1000");

    /** Voting window when the proposer gives none. */
    private int defaultVotingDays = 7;
}
