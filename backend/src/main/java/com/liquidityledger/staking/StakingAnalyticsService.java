package com.liquidityledger.staking;

import com.liquidityledger.common.Decimals;
import com.liquidityledger.domain.StakePosition;
import com.liquidityledger.domain.StakingPool;
import com.liquidityledger.validator.ValidatorRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read-only staking metrics. Not cached: pending rewards change with every tick of the clock.
 */
@Service
@RequiredArgsConstructor
public class StakingAnalyticsService {

    private final StakingLedger stakingLedger;
    private final ValidatorRegistry validatorRegistry;

    /**
     * @throws StakingLedgerException POOL_NOT_FOUND
     */
    public StakingPoolAnalytics poolAnalytics(String poolId) {
        StakingPool pool = stakingLedger.getPool(poolId);
        long activeStakers = stakingLedger.positionsInPool(poolId).stream()
                .filter(StakePosition::isActive)
                .count();
        BigDecimal average = activeStakers > 0
                ? Decimals.divide(pool.getTotalStaked(), BigDecimal.valueOf(activeStakers))
                : BigDecimal.ZERO;
        return new StakingPoolAnalytics(pool.getId(), pool.getName(), pool.getKind(), pool.getStakingToken(),
                pool.getRewardTokens(), pool.getTotalStaked(), pool.getTotalRewardsDistributed(),
                pool.getApy().multiply(Decimals.HUNDRED), activeStakers, average, pool.getMinStake(),
                pool.getMaxStake(), pool.getLockPeriodDays(), pool.isActive());
    }

    /** Every position of the owner with its pending rewards. */
    public List<StakePositionView> positionsOf(String owner) {
        return stakingLedger.positionsOf(owner).stream()
                .map(this::toView)
                .toList();
    }

    public StakingStatus status() {
        List<StakingPool> pools = stakingLedger.listPools();
        BigDecimal staked = pools.stream().map(StakingPool::getTotalStaked).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal rewards = pools.stream().map(StakingPool::getTotalRewardsDistributed)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new StakingStatus(pools.size(), staked, rewards, stakingLedger.positionCount(),
                validatorRegistry.listValidators().size(), validatorRegistry.activeValidatorCount());
    }

    private StakePositionView toView(StakePosition position) {
        String targetName = position.isDelegation()
                ? position.getPoolId()
                : stakingLedger.findPool(position.getPoolId()).map(StakingPool::getName).orElse(position.getPoolId());
        return new StakePositionView(position, targetName, stakingLedger.pendingRewards(position.getId()));
    }
}
