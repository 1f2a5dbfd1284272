package com.liquidityledger.amm;

import com.liquidityledger.common.Decimals;
import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.LiquidityPosition;
import com.liquidityledger.domain.Pool;
import com.liquidityledger.domain.PositionStatus;
import com.liquidityledger.pricing.PriceOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LP positions and their fee accrual. Positions live under their pool's lock: every mutation below either takes
 * that lock or is called by PoolLedger while holding it.
 * <p>
 * Fees use a reward-per-share accumulator: a swap bumps {@code pool.feePerShareUsd} by fee / lpSupply, and a
 * position settles {@code lpAmount * (acc - checkpoint)} whenever its balance changes or it is read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PositionTracker {

    private final Map<String, LiquidityPosition> positions = new ConcurrentHashMap<>();

    private final PoolBook poolBook;
    private final EntityLocks locks;
    private final PriceOracle priceOracle;

    /**
     * Credit a USD fee to every active position of the pool, pro rata to LP balance.
     * No-op when the pool has no LP supply or the fee is not positive.
     */
    public void distributeFees(String poolId, BigDecimal feeValueUsd) {
        Pool pool = poolBook.require(poolId);
        locks.runWithLock(EntityLocks.pool(poolId), () -> accrue(pool, feeValueUsd));
    }

    /**
     * Current impermanent loss of a position in percent. Read-only: the stored value is only refreshed when
     * liquidity is removed.
     */
    public BigDecimal impermanentLoss(String positionId) {
        LiquidityPosition position = requirePosition(positionId);
        Pool pool = poolBook.require(position.getPoolId());
        Map<String, BigDecimal> prices = priceOracle.pricesFor(pool.getTokens());
        return locks.withLock(EntityLocks.pool(pool.getId()),
                () -> impermanentLoss(pool, position, prices));
    }

    public LiquidityPosition getPosition(String positionId) {
        LiquidityPosition position = requirePosition(positionId);
        return readSettled(position);
    }

    public List<LiquidityPosition> positionsOf(String provider) {
        return positions.values().stream()
                .filter(p -> p.getProvider().equals(provider))
                .sorted(Comparator.comparing(LiquidityPosition::getEntryTime))
                .map(this::readSettled)
                .toList();
    }

    public List<LiquidityPosition> positionsInPool(String poolId) {
        return positions.values().stream()
                .filter(p -> p.getPoolId().equals(poolId))
                .sorted(Comparator.comparing(LiquidityPosition::getEntryTime))
                .map(this::readSettled)
                .toList();
    }

    /** Sum of LP held by active positions; equals the pool's lpSupply. */
    public BigDecimal totalLp(String poolId) {
        return locks.withLock(EntityLocks.pool(poolId), () -> positions.values().stream()
                .filter(p -> p.getPoolId().equals(poolId) && p.isActive())
                .map(LiquidityPosition::getLpAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /** Distinct providers with an active position in the pool. */
    public long providerCount(String poolId) {
        return positions.values().stream()
                .filter(p -> p.getPoolId().equals(poolId) && p.isActive())
                .map(LiquidityPosition::getProvider)
                .distinct()
                .count();
    }

    public long activePositionCount() {
        return positions.values().stream().filter(LiquidityPosition::isActive).count();
    }

    // --- called by PoolLedger with the pool lock held ---

    LiquidityPosition open(Pool pool, String provider, Map<String, BigDecimal> amounts, BigDecimal lpAmount,
                           Instant now) {
        LiquidityPosition position = new LiquidityPosition();
        position.setId(UUID.randomUUID().toString());
        position.setProvider(provider);
        position.setPoolId(pool.getId());
        position.setTokenAmounts(new LinkedHashMap<>(amounts));
        position.setLpAmount(lpAmount);
        position.setEntryTime(now);
        position.getFeesEarned().put(LiquidityPosition.USD, BigDecimal.ZERO);
        position.setFeeCheckpoint(pool.getFeePerShareUsd());
        position.setStatus(PositionStatus.ACTIVE);
        positions.put(position.getId(), position);
        return position;
    }

    Optional<LiquidityPosition> find(String positionId) {
        return positionId == null ? Optional.empty() : Optional.ofNullable(positions.get(positionId));
    }

    LiquidityPosition requirePosition(String positionId) {
        return find(positionId).orElseThrow(() -> new PoolLedgerException(
                PoolLedgerException.POSITION_NOT_FOUND, "Position not found: " + positionId));
    }

    void accrue(Pool pool, BigDecimal feeValueUsd) {
        if (!Decimals.isPositive(feeValueUsd) || !Decimals.isPositive(pool.getLpSupply())) {
            return;
        }
        BigDecimal perShare = Decimals.divide(feeValueUsd, pool.getLpSupply());
        pool.setFeePerShareUsd(pool.getFeePerShareUsd().add(perShare, Decimals.MC));
    }

    void settle(Pool pool, LiquidityPosition position) {
        BigDecimal delta = pool.getFeePerShareUsd().subtract(position.getFeeCheckpoint());
        if (position.isActive() && delta.signum() > 0) {
            BigDecimal earned = position.getLpAmount().multiply(delta, Decimals.MC);
            position.getFeesEarned().merge(LiquidityPosition.USD, earned, BigDecimal::add);
        }
        position.setFeeCheckpoint(pool.getFeePerShareUsd());
    }

    BigDecimal impermanentLoss(Pool pool, LiquidityPosition position, Map<String, BigDecimal> prices) {
        BigDecimal holdValue = BigDecimal.ZERO;
        for (Map.Entry<String, BigDecimal> entry : position.getTokenAmounts().entrySet()) {
            holdValue = holdValue.add(entry.getValue().multiply(prices.getOrDefault(entry.getKey(), BigDecimal.ZERO)));
        }
        if (holdValue.signum() == 0 || !Decimals.isPositive(pool.getLpSupply())) {
            return BigDecimal.ZERO;
        }
        BigDecimal share = Decimals.divide(position.getLpAmount(), pool.getLpSupply());
        BigDecimal lpValue = BigDecimal.ZERO;
        for (String token : pool.getTokens()) {
            lpValue = lpValue.add(pool.reserveOf(token).multiply(share).multiply(prices.get(token)));
        }
        return Decimals.divide(lpValue.subtract(holdValue), holdValue).multiply(Decimals.HUNDRED, Decimals.MC);
    }

    private LiquidityPosition readSettled(LiquidityPosition position) {
        Pool pool = poolBook.require(position.getPoolId());
        return locks.withLock(EntityLocks.pool(pool.getId()), () -> {
            settle(pool, position);
            return position.snapshot();
        });
    }
}
