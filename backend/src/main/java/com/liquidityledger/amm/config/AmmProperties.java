package com.liquidityledger.amm.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * AMM ledger config. Rates are fractions (0.003 = 0.3%).
 */
@ConfigurationProperties(prefix = "liquidityledger.amm")
@NoArgsConstructor
@Getter
@Setter
public class AmmProperties {

    /** Swap fee applied when create_pool is called without one. */
    private BigDecimal defaultSwapFee = new BigDecimal("0.003");

    /**
     * Share of each swap routed to the protocol instead of the pool. Capped at the pool's own fee rate,
     * so a zero-fee pool never charges a protocol fee.
     */
    private BigDecimal protocolFee = new BigDecimal("0.0005");

    /** Swaps whose price impact exceeds this fraction are rejected. */
    private BigDecimal maxPriceImpact = new BigDecimal("0.05");

    /** Look-back window for volume, fee and volatility analytics. */
    private Duration analyticsWindow = Duration.ofHours(24);
}
