package com.liquidityledger.amm;

import com.liquidityledger.amm.config.AmmProperties;
import com.liquidityledger.common.Decimals;
import com.liquidityledger.config.CaffeineConfig;
import com.liquidityledger.domain.Pool;
import com.liquidityledger.domain.PoolUpdatedEvent;
import com.liquidityledger.domain.SwapRecord;
import com.liquidityledger.pricing.PriceOracle;
import com.liquidityledger.pricing.TokenRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only pool metrics over the ledger's snapshots. Per-pool analytics are cached briefly and evicted whenever
 * the pool changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolAnalyticsService {

    private static final BigDecimal DAYS_PER_YEAR = BigDecimal.valueOf(365);
    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400);

    private final PoolLedger poolLedger;
    private final PositionTracker positionTracker;
    private final PriceOracle priceOracle;
    private final TokenRegistry tokenRegistry;
    private final AmmProperties ammProperties;
    private final Clock clock;

    /**
     * TVL, windowed volume and fees, fee APY and volatility for one pool.
     *
     * @throws PoolLedgerException POOL_NOT_FOUND
     */
    @Cacheable(cacheNames = CaffeineConfig.POOL_ANALYTICS_CACHE, key = "#poolId")
    public PoolAnalytics analytics(String poolId) {
        Pool pool = poolLedger.getPool(poolId);
        Map<String, BigDecimal> prices = priceOracle.pricesFor(pool.getTokens());
        BigDecimal tvl = valueLocked(pool, prices);

        Instant since = Instant.now(clock).minus(ammProperties.getAnalyticsWindow());
        List<SwapRecord> recent = poolLedger.swapHistory(poolId).stream()
                .filter(s -> s.timestamp().isAfter(since))
                .toList();
        BigDecimal volume = recent.stream()
                .map(SwapRecord::tradeValueUsd)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal fees = volume.multiply(pool.getSwapFeeRate());
        BigDecimal feeApy = BigDecimal.ZERO;
        if (tvl.signum() > 0) {
            BigDecimal dailyFees = Decimals.divide(fees.multiply(SECONDS_PER_DAY),
                    BigDecimal.valueOf(ammProperties.getAnalyticsWindow().toSeconds()));
            feeApy = Decimals.divide(dailyFees.multiply(DAYS_PER_YEAR), tvl).multiply(Decimals.HUNDRED);
        }

        return new PoolAnalytics(pool.getId(), pool.getName(), pool.getKind(), pool.getStatus(), pool.getReserves(),
                pool.getLpSupply(), pool.getSwapFeeRate(), tvl, volume, fees, feeApy, volatility(recent),
                positionTracker.providerCount(poolId), recent.size(), pool.getUpdatedAt());
    }

    public LedgerStatus ledgerStatus() {
        List<Pool> pools = poolLedger.listPools();
        BigDecimal tvl = BigDecimal.ZERO;
        int active = 0;
        for (Pool pool : pools) {
            tvl = tvl.add(valueLocked(pool, priceOracle.pricesFor(pool.getTokens())));
            if (pool.isActive()) {
                active++;
            }
        }
        return new LedgerStatus(pools.size(), active, positionTracker.activePositionCount(),
                poolLedger.totalSwapCount(), tvl, tokenRegistry.size());
    }

    @EventListener
    @CacheEvict(cacheNames = CaffeineConfig.POOL_ANALYTICS_CACHE, key = "#event.poolId()")
    public void onPoolUpdated(PoolUpdatedEvent event) {
        log.debug("Evicting analytics for pool {} ({})", event.poolId(), event.reason());
    }

    private static BigDecimal valueLocked(Pool pool, Map<String, BigDecimal> prices) {
        BigDecimal tvl = BigDecimal.ZERO;
        for (String token : pool.getTokens()) {
            tvl = tvl.add(pool.reserveOf(token).multiply(prices.get(token)));
        }
        return tvl;
    }

    /** Std-dev of |p_i - p_(i-1)| / p_(i-1) where p is amountOut / amountIn of each swap. */
    static BigDecimal volatility(List<SwapRecord> swaps) {
        if (swaps.size() < 2) {
            return BigDecimal.ZERO;
        }
        List<BigDecimal> changes = new ArrayList<>();
        BigDecimal previous = executionPrice(swaps.get(0));
        for (int i = 1; i < swaps.size(); i++) {
            BigDecimal current = executionPrice(swaps.get(i));
            if (previous.signum() > 0) {
                changes.add(Decimals.divide(current.subtract(previous).abs(), previous));
            }
            previous = current;
        }
        if (changes.isEmpty()) {
            return BigDecimal.ZERO;
        }
        BigDecimal count = BigDecimal.valueOf(changes.size());
        BigDecimal mean = Decimals.divide(changes.stream().reduce(BigDecimal.ZERO, BigDecimal::add), count);
        BigDecimal variance = Decimals.divide(changes.stream()
                .map(c -> c.subtract(mean).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add), count);
        return variance.sqrt(Decimals.MC);
    }

    private static BigDecimal executionPrice(SwapRecord swap) {
        return Decimals.divide(swap.amountOut(), swap.amountIn());
    }
}
