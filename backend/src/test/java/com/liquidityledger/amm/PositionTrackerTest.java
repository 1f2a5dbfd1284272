package com.liquidityledger.amm;

import com.liquidityledger.amm.config.AmmProperties;
import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.LiquidityPosition;
import com.liquidityledger.domain.PoolKind;
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
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@ExtendWith(MockitoExtension.class)
class PositionTrackerTest {

    private static final String POOL = "eth-usdc";

    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    TokenRegistry tokenRegistry;
    PositionTracker positionTracker;
    PoolLedger poolLedger;

    @BeforeEach
    void setUp() {
        tokenRegistry = new TokenRegistry();
        tokenRegistry.register("ETH", "ETH", "Ether", 18, null, new BigDecimal("2000"));
        tokenRegistry.register("USDC", "USDC", "USD Coin", 6, null, BigDecimal.ONE);
        EntityLocks locks = new EntityLocks();
        PoolBook poolBook = new PoolBook();
        positionTracker = new PositionTracker(poolBook, locks, tokenRegistry);
        poolLedger = new PoolLedger(poolBook, positionTracker, tokenRegistry, tokenRegistry, locks, new AmmProperties(),
                applicationEventPublisher, new MutableClock(Instant.parse("2025-03-01T00:00:00Z")));
        poolLedger.createPool(POOL, null, List.of("ETH", "USDC"), null, PoolKind.CONSTANT_PRODUCT, null);
    }

    private LiquidityPosition provide(String provider, String eth, String usdc) {
        return poolLedger.addLiquidity(POOL, provider, Map.of("ETH", new BigDecimal(eth), "USDC", new BigDecimal(usdc)));
    }

    @Test
    @DisplayName("fees are split pro rata to LP balance")
    void distributesProRata() {
        LiquidityPosition alice = provide("alice", "50", "100000");
        LiquidityPosition bob = provide("bob", "10", "20000");

        positionTracker.distributeFees(POOL, new BigDecimal("120"));

        assertThat(positionTracker.getPosition(alice.getId()).feesEarnedUsd()).isEqualByComparingTo("100");
        assertThat(positionTracker.getPosition(bob.getId()).feesEarnedUsd()).isEqualByComparingTo("20");
    }

    @Test
    @DisplayName("a swap credits its full fee value to providers")
    void swapFeesAccrue() {
        LiquidityPosition alice = provide("alice", "50", "100000");

        poolLedger.swap(POOL, "trader", "USDC", "ETH", new BigDecimal("1000"), null);

        assertThat(positionTracker.getPosition(alice.getId()).feesEarnedUsd()).isEqualByComparingTo("3");
    }

    @Test
    @DisplayName("a position opened later does not earn earlier fees")
    void lateProviderEarnsOnlyLaterFees() {
        LiquidityPosition alice = provide("alice", "50", "100000");
        positionTracker.distributeFees(POOL, new BigDecimal("50"));
        LiquidityPosition bob = provide("bob", "50", "100000");

        positionTracker.distributeFees(POOL, new BigDecimal("10"));

        assertThat(positionTracker.getPosition(alice.getId()).feesEarnedUsd()).isEqualByComparingTo("55");
        assertThat(positionTracker.getPosition(bob.getId()).feesEarnedUsd()).isEqualByComparingTo("5");
    }

    @Test
    void feesWithoutLiquidityAreDropped() {
        positionTracker.distributeFees(POOL, new BigDecimal("10"));
        LiquidityPosition alice = provide("alice", "50", "100000");

        assertThat(positionTracker.getPosition(alice.getId()).feesEarnedUsd()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("impermanent loss is negative once arbitrage follows a price move")
    void impermanentLossAfterPriceMove() {
        LiquidityPosition alice = provide("alice", "50", "100000");
        assertThat(positionTracker.impermanentLoss(alice.getId())).isEqualByComparingTo("0");

        tokenRegistry.updatePrice("ETH", new BigDecimal("4000"));
        poolLedger.swap(POOL, "arb", "USDC", "ETH", new BigDecimal("1000"), null);

        BigDecimal loss = positionTracker.impermanentLoss(alice.getId());
        assertThat(loss).isNegative();
        assertThat(loss).isCloseTo(new BigDecimal("-0.325"), within(new BigDecimal("0.001")));
        assertThat(positionTracker.getPosition(alice.getId()).getImpermanentLossPct()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("removing liquidity stores the pre-burn impermanent loss")
    void removalStoresLoss() {
        LiquidityPosition alice = provide("alice", "50", "100000");
        tokenRegistry.updatePrice("ETH", new BigDecimal("4000"));
        poolLedger.swap(POOL, "arb", "USDC", "ETH", new BigDecimal("1000"), null);
        BigDecimal expected = positionTracker.impermanentLoss(alice.getId());

        poolLedger.removeLiquidity(alice.getId(), new BigDecimal("40000"));

        assertThat(positionTracker.getPosition(alice.getId()).getImpermanentLossPct()).isEqualByComparingTo(expected);
    }

    @Test
    void queriesByProviderAndPool() {
        provide("alice", "50", "100000");
        provide("alice", "5", "10000");
        LiquidityPosition bob = provide("bob", "5", "10000");
        poolLedger.removeLiquidity(bob.getId(), bob.getLpAmount());

        assertThat(positionTracker.positionsOf("alice")).hasSize(2);
        assertThat(positionTracker.positionsInPool(POOL)).hasSize(3);
        assertThat(positionTracker.providerCount(POOL)).isEqualTo(1);
        assertThat(positionTracker.activePositionCount()).isEqualTo(2);
        assertThat(positionTracker.totalLp(POOL)).isEqualByComparingTo("110000");
    }

    @Test
    void unknownPositionIsRejected() {
        assertThatThrownBy(() -> positionTracker.getPosition("nope"))
                .isInstanceOf(PoolLedgerException.class)
                .extracting("errorCode").isEqualTo(PoolLedgerException.POSITION_NOT_FOUND);
    }
}
