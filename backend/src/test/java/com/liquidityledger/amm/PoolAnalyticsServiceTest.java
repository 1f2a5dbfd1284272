package com.liquidityledger.amm;

import com.liquidityledger.amm.config.AmmProperties;
import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.PoolKind;
import com.liquidityledger.domain.PoolStatus;
import com.liquidityledger.domain.SwapRecord;
import com.liquidityledger.pricing.TokenRegistry;
import com.liquidityledger.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@ExtendWith(MockitoExtension.class)
class PoolAnalyticsServiceTest {

    private static final String POOL = "eth-usdc";
    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");

    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    MutableClock clock = new MutableClock(START);
    PoolLedger poolLedger;
    PoolAnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        TokenRegistry tokenRegistry = new TokenRegistry();
        tokenRegistry.register("ETH", "ETH", "Ether", 18, null, new BigDecimal("2000"));
        tokenRegistry.register("USDC", "USDC", "USD Coin", 6, null, BigDecimal.ONE);
        tokenRegistry.register("DAI", "DAI", "Dai", 18, null, BigDecimal.ONE);
        EntityLocks locks = new EntityLocks();
        PoolBook poolBook = new PoolBook();
        AmmProperties ammProperties = new AmmProperties();
        PositionTracker positionTracker = new PositionTracker(poolBook, locks, tokenRegistry);
        poolLedger = new PoolLedger(poolBook, positionTracker, tokenRegistry, tokenRegistry, locks, ammProperties,
                applicationEventPublisher, clock);
        analyticsService = new PoolAnalyticsService(poolLedger, positionTracker, tokenRegistry, tokenRegistry,
                ammProperties, clock);
        poolLedger.createPool(POOL, null, List.of("ETH", "USDC"),
                Map.of("ETH", new BigDecimal("50"), "USDC", new BigDecimal("100000")), PoolKind.CONSTANT_PRODUCT,
                new BigDecimal("0.003"));
    }

    @Test
    @DisplayName("TVL is the USD value of all reserves")
    void tvl() {
        PoolAnalytics analytics = analyticsService.analytics(POOL);

        assertThat(analytics.tvlUsd()).isEqualByComparingTo("200000");
        assertThat(analytics.volumeUsd()).isEqualByComparingTo("0");
        assertThat(analytics.feeApyPct()).isEqualByComparingTo("0");
        assertThat(analytics.swapCount()).isZero();
        assertThat(analytics.providerCount()).isZero();
    }

    @Test
    @DisplayName("volume, fees and fee APY cover swaps inside the window")
    void windowedVolumeAndFees() {
        poolLedger.swap(POOL, "trader", "USDC", "ETH", new BigDecimal("1000"), null);

        PoolAnalytics analytics = analyticsService.analytics(POOL);

        assertThat(analytics.volumeUsd()).isEqualByComparingTo("1000");
        assertThat(analytics.feesUsd()).isEqualByComparingTo("3");
        assertThat(analytics.swapCount()).isEqualTo(1);
        assertThat(analytics.tvlUsd()).isCloseTo(new BigDecimal("200012.34"), within(new BigDecimal("0.01")));
        assertThat(analytics.feeApyPct()).isCloseTo(new BigDecimal("0.5475"), within(new BigDecimal("0.0001")));

        clock.advance(Duration.ofHours(25));

        PoolAnalytics later = analyticsService.analytics(POOL);
        assertThat(later.volumeUsd()).isEqualByComparingTo("0");
        assertThat(later.swapCount()).isZero();
    }

    @Test
    void ledgerStatusTotals() {
        poolLedger.createPool("dai-usdc", null, List.of("DAI", "USDC"),
                Map.of("DAI", new BigDecimal("1000"), "USDC", new BigDecimal("1000")), PoolKind.STABLE_SWAP, null);
        poolLedger.setStatus("dai-usdc", PoolStatus.PAUSED);
        poolLedger.swap(POOL, "trader", "USDC", "ETH", new BigDecimal("100"), null);

        LedgerStatus status = analyticsService.ledgerStatus();

        assertThat(status.totalPools()).isEqualTo(2);
        assertThat(status.activePools()).isEqualTo(1);
        assertThat(status.totalSwaps()).isEqualTo(1);
        assertThat(status.registeredTokens()).isEqualTo(3);
        assertThat(status.totalValueLockedUsd()).isGreaterThan(new BigDecimal("202000"));
    }

    @Test
    @DisplayName("volatility is the std-dev of relative execution price changes")
    void volatility() {
        List<SwapRecord> swaps = List.of(swapAt("1"), swapAt("1.1"), swapAt("1.1"));

        assertThat(PoolAnalyticsService.volatility(swaps)).isCloseTo(new BigDecimal("0.05"), within(new BigDecimal("1e-20")));
        assertThat(PoolAnalyticsService.volatility(List.of(swapAt("2")))).isEqualByComparingTo("0");
        assertThat(PoolAnalyticsService.volatility(List.of(swapAt("2"), swapAt("2")))).isEqualByComparingTo("0");
    }

    private static SwapRecord swapAt(String price) {
        return new SwapRecord("s", POOL, "t", "USDC", "ETH", BigDecimal.ONE, new BigDecimal(price), BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ONE, START);
    }
}
