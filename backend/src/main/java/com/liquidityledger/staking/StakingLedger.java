package com.liquidityledger.staking;

import com.liquidityledger.common.Decimals;
import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.PositionCreatedEvent;
import com.liquidityledger.domain.PositionType;
import com.liquidityledger.domain.RewardClaimedEvent;
import com.liquidityledger.domain.StakeKind;
import com.liquidityledger.domain.StakePosition;
import com.liquidityledger.domain.StakePositionBook;
import com.liquidityledger.domain.StakeStatus;
import com.liquidityledger.domain.StakingPool;
import com.liquidityledger.pricing.TokenRegistry;
import com.liquidityledger.staking.config.StakingProperties;
import com.liquidityledger.validator.ValidatorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Staking pools, stake positions and validator delegations. Pool positions are guarded by their staking pool's
 * lock, delegations by their validator's lock ({@link StakePositionBook#lockKeyFor(StakePosition)}).
 * Rewards accrue from stored timestamps and are only credited on claim.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StakingLedger {

    private final Map<String, StakingPool> pools = new ConcurrentHashMap<>();

    private final StakePositionBook stakePositionBook;
    private final ValidatorRegistry validatorRegistry;
    private final TokenRegistry tokenRegistry;
    private final RewardCalculator rewardCalculator;
    private final EntityLocks locks;
    private final StakingProperties stakingProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Create a staking pool. Delegation is not a pool kind; use {@link #delegate(String, String, BigDecimal)}.
     *
     * @param id       pool id, or null to generate one
     * @param minStake lower bound, configured default when null
     * @param maxStake upper bound, configured default when null
     * @throws StakingLedgerException INVALID_TOKEN, INVALID_POOL
     */
    public StakingPool createStakingPool(String id, String name, String stakingToken, List<String> rewardTokens,
                                         StakeKind kind, BigDecimal apy, int lockPeriodDays, BigDecimal minStake,
                                         BigDecimal maxStake) {
        if (!tokenRegistry.isRegistered(stakingToken)) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_TOKEN,
                    "Staking token not registered: " + stakingToken);
        }
        if (rewardTokens == null || rewardTokens.isEmpty()) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_POOL, "At least one reward token is required");
        }
        if (kind == null || kind == StakeKind.VALIDATOR_DELEGATION) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_POOL, "Unsupported staking pool kind: " + kind);
        }
        if (apy == null || apy.signum() < 0 || lockPeriodDays < 0) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_POOL, "APY and lock period must be non-negative");
        }
        BigDecimal min = minStake != null ? minStake : stakingProperties.getDefaultMinStake();
        BigDecimal max = maxStake != null ? maxStake : stakingProperties.getDefaultMaxStake();
        if (min.signum() < 0 || min.compareTo(max) > 0) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_POOL,
                    "Invalid stake bounds [" + min + ", " + max + "]");
        }

        Instant now = Instant.now(clock);
        StakingPool pool = new StakingPool();
        pool.setId(id != null ? id : UUID.randomUUID().toString());
        pool.setName(name != null ? name : stakingToken + " " + kind);
        pool.setStakingToken(stakingToken);
        pool.setRewardTokens(List.copyOf(rewardTokens));
        pool.setKind(kind);
        pool.setApy(apy);
        pool.setLockPeriodDays(lockPeriodDays);
        pool.setMinStake(min);
        pool.setMaxStake(max);
        pool.setCreatedAt(now);
        pool.setUpdatedAt(now);
        if (pools.putIfAbsent(pool.getId(), pool) != null) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_POOL,
                    "Staking pool already exists: " + pool.getId());
        }
        log.info("Created {} staking pool {} ({}) at APY {}, lock {} days", kind, pool.getId(), pool.getName(), apy,
                lockPeriodDays);
        return locks.withLock(EntityLocks.stakingPool(pool.getId()), pool::snapshot);
    }

    /**
     * Open a stake position. A lock applies when the pool is FIXED_TERM or lockDays is given; the multiplier is
     * the kind multiplier times the lock bonus.
     *
     * @param lockDays lock length in days, or null for the pool default (FIXED_TERM) or no lock
     * @throws StakingLedgerException POOL_NOT_FOUND, POOL_INACTIVE, STAKE_OUT_OF_BOUNDS, INVALID_AMOUNT
     */
    public StakePosition stake(String poolId, String owner, BigDecimal amount, Integer lockDays) {
        if (amount == null) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_AMOUNT, "Amount is required");
        }
        if (lockDays != null && lockDays < 0) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_AMOUNT, "Lock days must be non-negative");
        }
        StakingPool pool = requirePool(poolId);

        StakePosition created = locks.withLock(EntityLocks.stakingPool(poolId), () -> {
            if (!pool.isActive()) {
                throw new StakingLedgerException(StakingLedgerException.POOL_INACTIVE, "Staking pool inactive: " + poolId);
            }
            if (amount.compareTo(pool.getMinStake()) < 0 || amount.compareTo(pool.getMaxStake()) > 0) {
                throw new StakingLedgerException(StakingLedgerException.STAKE_OUT_OF_BOUNDS,
                        "Stake must be between " + pool.getMinStake() + " and " + pool.getMaxStake());
            }
            Instant now = Instant.now(clock);
            BigDecimal multiplier = pool.getKind().multiplier();
            Instant unlockTime = null;
            if (pool.getKind() == StakeKind.FIXED_TERM || lockDays != null) {
                int lock = lockDays != null ? lockDays : pool.getLockPeriodDays();
                unlockTime = now.plus(Duration.ofDays(lock));
                multiplier = multiplier.multiply(LockBonusSchedule.bonusFor(lock));
            }

            StakePosition position = new StakePosition();
            position.setId(UUID.randomUUID().toString());
            position.setOwner(owner);
            position.setPoolId(poolId);
            position.setAmount(amount);
            position.setKind(pool.getKind());
            position.setStatus(StakeStatus.ACTIVE);
            position.setMultiplier(multiplier);
            position.setStakeTime(now);
            position.setUnlockTime(unlockTime);
            position.setLastClaimTime(now);
            if (pool.getKind() == StakeKind.GOVERNANCE) {
                position.setGovernancePower(amount.multiply(multiplier));
            }
            stakePositionBook.add(position);
            pool.setTotalStaked(pool.getTotalStaked().add(amount));
            pool.setUpdatedAt(now);
            return position.snapshot();
        });

        log.info("Owner {} staked {} in pool {} (stake {}, multiplier {})", owner, amount, poolId, created.getId(),
                created.getMultiplier());
        applicationEventPublisher.publishEvent(new PositionCreatedEvent(created.getId(), PositionType.STAKE, owner,
                poolId, amount, created.getStakeTime()));
        return created;
    }

    /**
     * Credit rewards accrued since the last claim and advance the claim time. A second claim at the same instant
     * yields zero.
     *
     * @throws StakingLedgerException STAKE_NOT_FOUND, STAKE_NOT_ACTIVE
     */
    public Map<String, BigDecimal> claimRewards(String stakeId) {
        StakePosition position = requirePosition(stakeId);

        ClaimOutcome outcome = locks.withLock(StakePositionBook.lockKeyFor(position), () -> {
            if (!position.isActive()) {
                throw new StakingLedgerException(StakingLedgerException.STAKE_NOT_ACTIVE,
                        "Stake " + stakeId + " is " + position.getStatus());
            }
            Instant now = Instant.now(clock);
            Map<String, BigDecimal> rewards = accrued(position, now);
            rewards.forEach((token, amount) -> position.getAccruedRewards().merge(token, amount, BigDecimal::add));
            position.setLastClaimTime(now);
            if (!position.isDelegation()) {
                StakingPool pool = requirePool(position.getPoolId());
                BigDecimal total = rewards.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
                pool.setTotalRewardsDistributed(pool.getTotalRewardsDistributed().add(total));
                pool.setUpdatedAt(now);
            }
            return new ClaimOutcome(Map.copyOf(rewards), now);
        });

        log.info("Stake {} claimed rewards {}", stakeId, outcome.rewards());
        applicationEventPublisher.publishEvent(new RewardClaimedEvent(stakeId, position.getOwner(), outcome.rewards(),
                outcome.claimedAt()));
        return outcome.rewards();
    }

    /**
     * Withdraw part or all of an ACTIVE position. Fixed-term stakes leaving before their unlock time pay the
     * early-withdrawal penalty. Full withdrawal ends in WITHDRAWN, a flexible partial stays ACTIVE and any other
     * partial moves to UNBONDING. Delegations stay bonded, and slashable, until their unlock time.
     *
     * @param amount amount to withdraw, or null for the whole position
     * @throws StakingLedgerException STAKE_NOT_FOUND, STAKE_NOT_ACTIVE, INVALID_AMOUNT, EXCEEDS_STAKED, STILL_BONDED
     */
    public UnstakeResult unstake(String stakeId, BigDecimal amount) {
        if (amount != null && amount.signum() <= 0) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_AMOUNT, "Unstake amount must be positive");
        }
        StakePosition position = requirePosition(stakeId);

        UnstakeResult result = locks.withLock(StakePositionBook.lockKeyFor(position), () -> {
            if (!position.isActive()) {
                throw new StakingLedgerException(StakingLedgerException.STAKE_NOT_ACTIVE,
                        "Stake " + stakeId + " is " + position.getStatus());
            }
            BigDecimal withdrawn = amount != null ? amount : position.getAmount();
            if (withdrawn.compareTo(position.getAmount()) > 0) {
                throw new StakingLedgerException(StakingLedgerException.EXCEEDS_STAKED,
                        "Stake " + stakeId + " holds " + position.getAmount() + ", requested " + withdrawn);
            }
            Instant now = Instant.now(clock);
            if (position.isDelegation() && position.getUnlockTime() != null && now.isBefore(position.getUnlockTime())) {
                throw new StakingLedgerException(StakingLedgerException.STILL_BONDED,
                        "Delegation " + stakeId + " is bonded until " + position.getUnlockTime());
            }
            boolean early = position.getKind() == StakeKind.FIXED_TERM
                    && position.getUnlockTime() != null && now.isBefore(position.getUnlockTime());
            BigDecimal penalty = early
                    ? withdrawn.multiply(stakingProperties.getEarlyWithdrawalPenalty())
                    : BigDecimal.ZERO;
            Map<String, BigDecimal> pending = accrued(position, now);
            BigDecimal previousAmount = position.getAmount();
            BigDecimal remaining = previousAmount.subtract(withdrawn);

            if (position.getGovernancePower().signum() > 0) {
                position.setGovernancePower(remaining.signum() == 0
                        ? BigDecimal.ZERO
                        : Decimals.divide(position.getGovernancePower().multiply(remaining), previousAmount));
            }
            position.setAmount(remaining);
            position.setPenaltyApplied(position.getPenaltyApplied().add(penalty));
            if (remaining.signum() == 0) {
                position.setStatus(StakeStatus.WITHDRAWN);
            } else if (position.getKind() != StakeKind.FLEXIBLE) {
                position.setStatus(StakeStatus.UNBONDING);
            }
            if (position.isDelegation()) {
                validatorRegistry.adjustDelegatedStake(position.getPoolId(), withdrawn.negate());
            } else {
                StakingPool pool = requirePool(position.getPoolId());
                pool.setTotalStaked(pool.getTotalStaked().subtract(withdrawn));
                pool.setUpdatedAt(now);
            }
            return new UnstakeResult(stakeId, withdrawn, penalty, early, withdrawn.subtract(penalty), remaining,
                    position.getStatus(), Map.copyOf(pending), now);
        });

        log.info("Stake {} unstaked {} (penalty {}, status {})", stakeId, result.withdrawnAmount(), result.penalty(),
                result.status());
        return result;
    }

    /**
     * Delegate to a validator. The delegation unlocks after the unbonding period and is slashed with its validator.
     *
     * @throws StakingLedgerException INVALID_AMOUNT
     * @throws com.liquidityledger.validator.ValidatorRegistryException VALIDATOR_NOT_FOUND, VALIDATOR_INACTIVE
     */
    public StakePosition delegate(String owner, String validatorId, BigDecimal amount) {
        if (!Decimals.isPositive(amount)) {
            throw new StakingLedgerException(StakingLedgerException.INVALID_AMOUNT, "Delegation amount must be positive");
        }
        StakePosition created = locks.withLock(EntityLocks.validator(validatorId), () -> {
            validatorRegistry.requireActive(validatorId);
            Instant now = Instant.now(clock);
            StakePosition position = new StakePosition();
            position.setId(UUID.randomUUID().toString());
            position.setOwner(owner);
            position.setPoolId(validatorId);
            position.setAmount(amount);
            position.setKind(StakeKind.VALIDATOR_DELEGATION);
            position.setStatus(StakeStatus.ACTIVE);
            position.setMultiplier(StakeKind.VALIDATOR_DELEGATION.multiplier());
            position.setStakeTime(now);
            position.setUnlockTime(now.plus(stakingProperties.getUnbondingPeriod()));
            position.setLastClaimTime(now);
            stakePositionBook.add(position);
            validatorRegistry.adjustDelegatedStake(validatorId, amount);
            return position.snapshot();
        });

        log.info("Owner {} delegated {} to validator {} (delegation {})", owner, amount, validatorId, created.getId());
        applicationEventPublisher.publishEvent(new PositionCreatedEvent(created.getId(), PositionType.DELEGATION,
                owner, validatorId, amount, created.getStakeTime()));
        return created;
    }

    /** Enable or disable new stakes in a pool. Existing positions are unaffected. */
    public StakingPool setPoolActive(String poolId, boolean active) {
        StakingPool pool = requirePool(poolId);
        StakingPool snapshot = locks.withLock(EntityLocks.stakingPool(poolId), () -> {
            pool.setActive(active);
            pool.setUpdatedAt(Instant.now(clock));
            return pool.snapshot();
        });
        log.info("Staking pool {} active={}", poolId, active);
        return snapshot;
    }

    /** Rewards accrued since the last claim, without crediting them. */
    public Map<String, BigDecimal> pendingRewards(String stakeId) {
        StakePosition position = requirePosition(stakeId);
        return locks.withLock(StakePositionBook.lockKeyFor(position),
                () -> Map.copyOf(accrued(position, Instant.now(clock))));
    }

    public StakingPool getPool(String poolId) {
        StakingPool pool = requirePool(poolId);
        return locks.withLock(EntityLocks.stakingPool(poolId), pool::snapshot);
    }

    public Optional<StakingPool> findPool(String poolId) {
        return Optional.ofNullable(poolId).map(pools::get)
                .map(p -> locks.withLock(EntityLocks.stakingPool(p.getId()), p::snapshot));
    }

    public List<StakingPool> listPools() {
        List<StakingPool> result = new ArrayList<>();
        for (StakingPool pool : pools.values()) {
            result.add(locks.withLock(EntityLocks.stakingPool(pool.getId()), pool::snapshot));
        }
        result.sort(Comparator.comparing(StakingPool::getCreatedAt).thenComparing(StakingPool::getId));
        return result;
    }

    public StakePosition getPosition(String stakeId) {
        StakePosition position = requirePosition(stakeId);
        return locks.withLock(StakePositionBook.lockKeyFor(position), position::snapshot);
    }

    /** All positions of an owner, stakes and delegations, oldest first. */
    public List<StakePosition> positionsOf(String owner) {
        return stakePositionBook.ownedBy(owner).stream()
                .map(p -> locks.withLock(StakePositionBook.lockKeyFor(p), p::snapshot))
                .sorted(Comparator.comparing(StakePosition::getStakeTime).thenComparing(StakePosition::getId))
                .toList();
    }

    public List<StakePosition> positionsInPool(String poolId) {
        requirePool(poolId);
        return locks.withLock(EntityLocks.stakingPool(poolId), () -> stakePositionBook.inStakingPool(poolId).stream()
                .map(StakePosition::snapshot)
                .sorted(Comparator.comparing(StakePosition::getStakeTime).thenComparing(StakePosition::getId))
                .toList());
    }

    public int positionCount() {
        return stakePositionBook.size();
    }

    private Map<String, BigDecimal> accrued(StakePosition position, Instant now) {
        if (position.isDelegation()) {
            return rewardCalculator.accrued(position, stakingProperties.getDelegationApy(),
                    List.of(stakingProperties.getDelegationRewardToken()), now);
        }
        StakingPool pool = requirePool(position.getPoolId());
        return rewardCalculator.accrued(position, pool.getApy(), pool.getRewardTokens(), now);
    }

    private StakingPool requirePool(String poolId) {
        StakingPool pool = poolId == null ? null : pools.get(poolId);
        if (pool == null) {
            throw new StakingLedgerException(StakingLedgerException.POOL_NOT_FOUND, "Staking pool not found: " + poolId);
        }
        return pool;
    }

    private StakePosition requirePosition(String stakeId) {
        return stakePositionBook.find(stakeId).orElseThrow(() -> new StakingLedgerException(
                StakingLedgerException.STAKE_NOT_FOUND, "Stake position not found: " + stakeId));
    }

    private record ClaimOutcome(Map<String, BigDecimal> rewards, Instant claimedAt) {
    }
}
