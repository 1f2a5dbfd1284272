package com.liquidityledger.amm;

import com.liquidityledger.amm.config.AmmProperties;
import com.liquidityledger.common.Decimals;
import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.LiquidityPosition;
import com.liquidityledger.domain.Pool;
import com.liquidityledger.domain.PoolKind;
import com.liquidityledger.domain.PoolStatus;
import com.liquidityledger.domain.PoolUpdatedEvent;
import com.liquidityledger.domain.PositionCreatedEvent;
import com.liquidityledger.domain.PositionStatus;
import com.liquidityledger.domain.PositionType;
import com.liquidityledger.domain.SwapExecutedEvent;
import com.liquidityledger.domain.SwapRecord;
import com.liquidityledger.pricing.PriceOracle;
import com.liquidityledger.pricing.TokenRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pool reserves, LP supply and swaps. Each pool is guarded by its own lock; prices are resolved before the lock is
 * taken and events are published after it is released. Validation and arithmetic complete before the first write,
 * so a rejected operation leaves the pool untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PoolLedger {

    private final PoolBook poolBook;
    private final PositionTracker positionTracker;
    private final TokenRegistry tokenRegistry;
    private final PriceOracle priceOracle;
    private final EntityLocks locks;
    private final AmmProperties ammProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Create a pool with lpSupply 0. Pool tokens missing from initialReserves start at zero.
     *
     * @param id      pool id, or null to generate one
     * @param kind    pricing curve, CONSTANT_PRODUCT when null
     * @param feeRate swap fee in [0, 1), configured default when null
     * @throws PoolLedgerException INVALID_POOL, INVALID_TOKEN
     */
    public Pool createPool(String id, String name, List<String> tokens, Map<String, BigDecimal> initialReserves,
                           PoolKind kind, BigDecimal feeRate) {
        if (tokens == null || new LinkedHashSet<>(tokens).size() != tokens.size() || tokens.size() < 2) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_POOL, "Pool needs at least two distinct tokens");
        }
        for (String token : tokens) {
            if (!tokenRegistry.isRegistered(token)) {
                throw new PoolLedgerException(PoolLedgerException.INVALID_TOKEN, "Token not registered: " + token);
            }
        }
        Map<String, BigDecimal> reserves = new LinkedHashMap<>();
        tokens.forEach(t -> reserves.put(t, BigDecimal.ZERO));
        if (initialReserves != null) {
            for (Map.Entry<String, BigDecimal> entry : initialReserves.entrySet()) {
                if (!reserves.containsKey(entry.getKey())) {
                    throw new PoolLedgerException(PoolLedgerException.INVALID_POOL,
                            "Reserve for token outside the pool: " + entry.getKey());
                }
                if (entry.getValue() == null || entry.getValue().signum() < 0) {
                    throw new PoolLedgerException(PoolLedgerException.INVALID_POOL,
                            "Negative reserve for " + entry.getKey());
                }
                reserves.put(entry.getKey(), entry.getValue());
            }
        }
        BigDecimal fee = feeRate != null ? feeRate : ammProperties.getDefaultSwapFee();
        if (fee.signum() < 0 || fee.compareTo(BigDecimal.ONE) >= 0) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_POOL, "Fee rate must be in [0, 1): " + fee);
        }

        Instant now = Instant.now(clock);
        Pool pool = new Pool();
        pool.setId(id != null ? id : UUID.randomUUID().toString());
        pool.setName(name != null ? name : String.join("/", tokens));
        pool.setKind(kind != null ? kind : PoolKind.CONSTANT_PRODUCT);
        pool.setStatus(PoolStatus.ACTIVE);
        pool.setTokens(List.copyOf(tokens));
        pool.setReserves(reserves);
        pool.setSwapFeeRate(fee);
        pool.setCreatedAt(now);
        pool.setUpdatedAt(now);
        if (!poolBook.add(pool)) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_POOL, "Pool already exists: " + pool.getId());
        }
        log.info("Created {} pool {} ({}) with fee {}", pool.getKind(), pool.getId(), pool.getName(), fee);
        Pool snapshot = locks.withLock(EntityLocks.pool(pool.getId()), pool::snapshot);
        publishPoolUpdated(snapshot, "CREATED");
        return snapshot;
    }

    /**
     * Deposit tokens and mint LP. The first provision mints the geometric mean of the deposited USD values;
     * later ones mint pro rata to the scarcest deposited reserve ratio. Opens a new position for the provider.
     *
     * @throws PoolLedgerException POOL_NOT_FOUND, POOL_INACTIVE, UNKNOWN_TOKEN, INVALID_AMOUNT, ZERO_LIQUIDITY_MINTED
     */
    public LiquidityPosition addLiquidity(String poolId, String provider, Map<String, BigDecimal> amounts) {
        if (amounts == null || amounts.isEmpty()) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_AMOUNT, "No amounts given");
        }
        for (Map.Entry<String, BigDecimal> entry : amounts.entrySet()) {
            if (!Decimals.isPositive(entry.getValue())) {
                throw new PoolLedgerException(PoolLedgerException.INVALID_AMOUNT,
                        "Amount must be positive for " + entry.getKey());
            }
        }
        Pool pool = poolBook.require(poolId);
        for (String token : amounts.keySet()) {
            if (!pool.containsToken(token)) {
                throw new PoolLedgerException(PoolLedgerException.UNKNOWN_TOKEN,
                        "Token " + token + " is not in pool " + poolId);
            }
        }
        Map<String, BigDecimal> prices = priceOracle.pricesFor(pool.getTokens());

        AddOutcome outcome = locks.withLock(EntityLocks.pool(poolId), () -> {
            requireActive(pool);
            BigDecimal minted = Decimals.isPositive(pool.getLpSupply())
                    ? proportionalMint(pool, amounts)
                    : initialMint(pool, amounts, prices);
            if (minted.signum() <= 0) {
                throw new PoolLedgerException(PoolLedgerException.ZERO_LIQUIDITY_MINTED,
                        "Deposit mints no liquidity in pool " + poolId);
            }
            Instant now = Instant.now(clock);
            amounts.forEach((token, amount) -> pool.getReserves().merge(token, amount, BigDecimal::add));
            pool.setLpSupply(pool.getLpSupply().add(minted));
            pool.setUpdatedAt(now);
            LiquidityPosition position = positionTracker.open(pool, provider, amounts, minted, now);
            return new AddOutcome(position.snapshot(), pool.snapshot());
        });

        log.info("Provider {} added liquidity to pool {}: {} LP", provider, poolId, outcome.position().getLpAmount());
        applicationEventPublisher.publishEvent(new PositionCreatedEvent(outcome.position().getId(),
                PositionType.LIQUIDITY, provider, poolId, outcome.position().getLpAmount(),
                outcome.position().getEntryTime()));
        publishPoolUpdated(outcome.pool(), "LIQUIDITY_ADDED");
        return outcome.position();
    }

    /**
     * Burn LP from a position and return the withdrawn reserves per token. Allowed in every pool status.
     * Impermanent loss is stored on the position from the pre-burn state.
     *
     * @throws PoolLedgerException INVALID_AMOUNT, POSITION_NOT_FOUND, POSITION_CLOSED, INSUFFICIENT_LP
     */
    public Map<String, BigDecimal> removeLiquidity(String positionId, BigDecimal lpAmount) {
        if (!Decimals.isPositive(lpAmount)) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_AMOUNT, "LP amount must be positive");
        }
        LiquidityPosition position = positionTracker.requirePosition(positionId);
        Pool pool = poolBook.require(position.getPoolId());
        Map<String, BigDecimal> prices = priceOracle.pricesFor(pool.getTokens());

        RemoveOutcome outcome = locks.withLock(EntityLocks.pool(pool.getId()), () -> {
            if (position.getStatus() == PositionStatus.CLOSED) {
                throw new PoolLedgerException(PoolLedgerException.POSITION_CLOSED, "Position closed: " + positionId);
            }
            if (lpAmount.compareTo(position.getLpAmount()) > 0) {
                throw new PoolLedgerException(PoolLedgerException.INSUFFICIENT_LP,
                        "Position " + positionId + " holds " + position.getLpAmount() + " LP, requested " + lpAmount);
            }
            BigDecimal impermanentLoss = positionTracker.impermanentLoss(pool, position, prices);
            Map<String, BigDecimal> withdrawn = new LinkedHashMap<>();
            for (String token : pool.getTokens()) {
                BigDecimal reserve = pool.reserveOf(token);
                BigDecimal amount = lpAmount.compareTo(pool.getLpSupply()) == 0
                        ? reserve
                        : Decimals.divide(reserve.multiply(lpAmount), pool.getLpSupply());
                withdrawn.put(token, amount);
            }

            positionTracker.settle(pool, position);
            position.setImpermanentLossPct(impermanentLoss);
            withdrawn.forEach((token, amount) -> pool.getReserves().put(token, pool.reserveOf(token).subtract(amount)));
            pool.setLpSupply(pool.getLpSupply().subtract(lpAmount));
            pool.setUpdatedAt(Instant.now(clock));
            position.setLpAmount(position.getLpAmount().subtract(lpAmount));
            if (position.getLpAmount().signum() == 0) {
                position.setStatus(PositionStatus.CLOSED);
            }
            return new RemoveOutcome(withdrawn, pool.snapshot());
        });

        log.info("Removed {} LP from position {} in pool {}", lpAmount, positionId, pool.getId());
        publishPoolUpdated(outcome.pool(), "LIQUIDITY_REMOVED");
        return outcome.withdrawn();
    }

    /**
     * Execute a swap. The protocol share of the fee is kept out of the pool; the rest stays in reserves, and the
     * full fee value is credited to LPs.
     *
     * @param minAmountOut slippage floor, or null for none
     * @throws PoolLedgerException POOL_NOT_FOUND, POOL_INACTIVE, UNKNOWN_TOKEN_PAIR, INVALID_AMOUNT,
     *                             PRICE_IMPACT_EXCEEDED, SLIPPAGE_EXCEEDED, INSUFFICIENT_RESERVES
     */
    public SwapRecord swap(String poolId, String trader, String tokenIn, String tokenOut, BigDecimal amountIn,
                           BigDecimal minAmountOut) {
        Pool pool = prepareSwap(poolId, tokenIn, tokenOut, amountIn);
        BigDecimal priceIn = priceOracle.priceOf(tokenIn);

        SwapOutcome outcome = locks.withLock(EntityLocks.pool(poolId), () -> {
            requireActive(pool);
            SwapQuote quote = price(pool, tokenIn, tokenOut, amountIn);
            if (quote.priceImpactPct().compareTo(ammProperties.getMaxPriceImpact()) > 0) {
                log.debug("Swap rejected on pool {}: price impact {} above {}", poolId, quote.priceImpactPct(),
                        ammProperties.getMaxPriceImpact());
                throw new PoolLedgerException(PoolLedgerException.PRICE_IMPACT_EXCEEDED,
                        "Price impact " + quote.priceImpactPct() + " exceeds " + ammProperties.getMaxPriceImpact());
            }
            BigDecimal slippage = BigDecimal.ZERO;
            if (minAmountOut != null) {
                if (quote.amountOut().compareTo(minAmountOut) < 0) {
                    throw new PoolLedgerException(PoolLedgerException.SLIPPAGE_EXCEEDED,
                            "Output " + quote.amountOut() + " below minimum " + minAmountOut);
                }
                if (minAmountOut.signum() > 0) {
                    slippage = Decimals.divide(minAmountOut.subtract(quote.amountOut()), minAmountOut);
                }
            }

            Instant now = Instant.now(clock);
            BigDecimal tradeValueUsd = amountIn.multiply(priceIn);
            BigDecimal feeValueUsd = quote.feePaid().multiply(priceIn);
            pool.getReserves().put(tokenIn, pool.reserveOf(tokenIn).add(amountIn).subtract(quote.protocolFee()));
            pool.getReserves().put(tokenOut, pool.reserveOf(tokenOut).subtract(quote.amountOut()));
            if (quote.protocolFee().signum() > 0) {
                pool.getProtocolFeesCollected().merge(tokenIn, quote.protocolFee(), BigDecimal::add);
            }
            pool.setVolumeUsd(pool.getVolumeUsd().add(tradeValueUsd));
            pool.setFeesCollectedUsd(pool.getFeesCollectedUsd().add(feeValueUsd));
            pool.setUpdatedAt(now);
            positionTracker.accrue(pool, feeValueUsd);

            SwapRecord swap = new SwapRecord(UUID.randomUUID().toString(), poolId, trader, tokenIn, tokenOut,
                    amountIn, quote.amountOut(), quote.priceImpactPct(), quote.feePaid(), quote.protocolFee(),
                    slippage, tradeValueUsd, now);
            poolBook.appendSwap(swap);
            return new SwapOutcome(swap, pool.snapshot());
        });

        SwapRecord swap = outcome.swap();
        log.info("Swap {} on pool {}: {} {} -> {} {} (impact {})", swap.id(), poolId, amountIn, tokenIn,
                swap.amountOut(), tokenOut, swap.priceImpactPct());
        applicationEventPublisher.publishEvent(new SwapExecutedEvent(swap));
        publishPoolUpdated(outcome.pool(), "SWAP");
        return swap;
    }

    /**
     * Price a swap against current reserves without executing it. Impact and slippage limits are not applied.
     *
     * @throws PoolLedgerException POOL_NOT_FOUND, UNKNOWN_TOKEN_PAIR, INVALID_AMOUNT, INSUFFICIENT_RESERVES
     */
    public SwapQuote quoteSwap(String poolId, String tokenIn, String tokenOut, BigDecimal amountIn) {
        Pool pool = prepareSwap(poolId, tokenIn, tokenOut, amountIn);
        return locks.withLock(EntityLocks.pool(poolId), () -> price(pool, tokenIn, tokenOut, amountIn));
    }

    /**
     * Move a pool between statuses. DEPRECATED is terminal.
     *
     * @throws PoolLedgerException POOL_NOT_FOUND, INVALID_STATUS_TRANSITION
     */
    public Pool setStatus(String poolId, PoolStatus status) {
        if (status == null) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_STATUS_TRANSITION, "Status is required");
        }
        Pool pool = poolBook.require(poolId);
        Pool snapshot = locks.withLock(EntityLocks.pool(poolId), () -> {
            if (pool.getStatus() == PoolStatus.DEPRECATED && status != PoolStatus.DEPRECATED) {
                throw new PoolLedgerException(PoolLedgerException.INVALID_STATUS_TRANSITION,
                        "Pool " + poolId + " is deprecated");
            }
            pool.setStatus(status);
            pool.setUpdatedAt(Instant.now(clock));
            return pool.snapshot();
        });
        log.info("Pool {} status set to {}", poolId, status);
        publishPoolUpdated(snapshot, "STATUS_" + status.name());
        return snapshot;
    }

    public Pool getPool(String poolId) {
        Pool pool = poolBook.require(poolId);
        return locks.withLock(EntityLocks.pool(poolId), pool::snapshot);
    }

    public List<Pool> listPools() {
        List<Pool> result = new ArrayList<>();
        for (Pool pool : poolBook.all()) {
            result.add(locks.withLock(EntityLocks.pool(pool.getId()), pool::snapshot));
        }
        result.sort(Comparator.comparing(Pool::getCreatedAt).thenComparing(Pool::getId));
        return result;
    }

    /** Swaps executed on the pool, oldest first. */
    public List<SwapRecord> swapHistory(String poolId) {
        poolBook.require(poolId);
        return poolBook.swapsOf(poolId);
    }

    public int totalSwapCount() {
        return poolBook.swapCount();
    }

    /** Product of all reserves; k for a two-asset constant-product pool. */
    public BigDecimal constantProductInvariant(String poolId) {
        Pool pool = poolBook.require(poolId);
        return locks.withLock(EntityLocks.pool(poolId), () -> pool.getReserves().values().stream()
                .reduce(BigDecimal.ONE, BigDecimal::multiply));
    }

    private Pool prepareSwap(String poolId, String tokenIn, String tokenOut, BigDecimal amountIn) {
        if (!Decimals.isPositive(amountIn)) {
            throw new PoolLedgerException(PoolLedgerException.INVALID_AMOUNT, "Swap amount must be positive");
        }
        Pool pool = poolBook.require(poolId);
        if (tokenIn == null || tokenIn.equals(tokenOut) || !pool.containsToken(tokenIn) || !pool.containsToken(tokenOut)) {
            throw new PoolLedgerException(PoolLedgerException.UNKNOWN_TOKEN_PAIR,
                    "Pool " + poolId + " cannot swap " + tokenIn + " for " + tokenOut);
        }
        return pool;
    }

    private SwapQuote price(Pool pool, String tokenIn, String tokenOut, BigDecimal amountIn) {
        BigDecimal reserveIn = pool.reserveOf(tokenIn);
        BigDecimal reserveOut = pool.reserveOf(tokenOut);
        if (reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            throw new PoolLedgerException(PoolLedgerException.INSUFFICIENT_RESERVES, "Pool " + pool.getId() + " is empty");
        }
        BigDecimal feePaid = amountIn.multiply(pool.getSwapFeeRate());
        BigDecimal protocolFee = amountIn.multiply(ammProperties.getProtocolFee().min(pool.getSwapFeeRate()));
        BigDecimal netIn = amountIn.subtract(feePaid);
        BigDecimal amountOut = pool.getKind().amountOut(netIn, reserveIn, reserveOut);
        if (amountOut.compareTo(reserveOut) >= 0) {
            throw new PoolLedgerException(PoolLedgerException.INSUFFICIENT_RESERVES,
                    "Output " + amountOut + " would drain reserve " + reserveOut);
        }
        BigDecimal priceBefore = Decimals.divide(reserveOut, reserveIn);
        BigDecimal priceAfter = Decimals.divide(reserveOut.subtract(amountOut), reserveIn.add(amountIn));
        BigDecimal impact = Decimals.divide(priceAfter.subtract(priceBefore).abs(), priceBefore);
        return new SwapQuote(pool.getId(), tokenIn, tokenOut, amountIn, amountOut, feePaid, protocolFee, impact);
    }

    private void requireActive(Pool pool) {
        if (!pool.isActive()) {
            throw new PoolLedgerException(PoolLedgerException.POOL_INACTIVE,
                    "Pool " + pool.getId() + " is " + pool.getStatus());
        }
    }

    private BigDecimal initialMint(Pool pool, Map<String, BigDecimal> amounts, Map<String, BigDecimal> prices) {
        BigDecimal product = BigDecimal.ONE;
        for (String token : pool.getTokens()) {
            BigDecimal value = amounts.getOrDefault(token, BigDecimal.ZERO).multiply(prices.get(token));
            product = product.multiply(value);
        }
        return Decimals.nthRoot(product, pool.getTokens().size());
    }

    private BigDecimal proportionalMint(Pool pool, Map<String, BigDecimal> amounts) {
        BigDecimal minRatio = null;
        for (String token : pool.getTokens()) {
            BigDecimal reserve = pool.reserveOf(token);
            if (reserve.signum() <= 0) {
                continue;
            }
            BigDecimal ratio = Decimals.divide(amounts.getOrDefault(token, BigDecimal.ZERO), reserve);
            minRatio = minRatio == null ? ratio : minRatio.min(ratio);
        }
        return minRatio == null ? BigDecimal.ZERO : pool.getLpSupply().multiply(minRatio, Decimals.MC);
    }

    private void publishPoolUpdated(Pool snapshot, String reason) {
        applicationEventPublisher.publishEvent(new PoolUpdatedEvent(snapshot.getId(), snapshot.getStatus(),
                snapshot.getReserves(), snapshot.getLpSupply(), reason, snapshot.getUpdatedAt()));
    }

    private record AddOutcome(LiquidityPosition position, Pool pool) {
    }

    private record RemoveOutcome(Map<String, BigDecimal> withdrawn, Pool pool) {
    }

    private record SwapOutcome(SwapRecord swap, Pool pool) {
    }
}
