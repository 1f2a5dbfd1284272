package com.liquidityledger.domain;

import com.liquidityledger.common.EntityLocks;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory arena of stake positions, shared by the staking ledger, the validator registry and governance.
 * Holds authoritative instances: callers mutate a position only while holding {@link #lockKeyFor(StakePosition)}.
 */
@Component
public class StakePositionBook {

    private final Map<String, StakePosition> positions = new ConcurrentHashMap<>();

    public void add(StakePosition position) {
        positions.put(position.getId(), position);
    }

    public Optional<StakePosition> find(String stakeId) {
        return Optional.ofNullable(positions.get(stakeId));
    }

    /** Delegations are guarded by their validator's lock so a slash covers them in one critical section. */
    public static String lockKeyFor(StakePosition position) {
        return position.isDelegation()
                ? EntityLocks.validator(position.getPoolId())
                : EntityLocks.stakingPool(position.getPoolId());
    }

    public List<StakePosition> delegationsTo(String validatorId) {
        return positions.values().stream()
                .filter(StakePosition::isDelegation)
                .filter(p -> validatorId.equals(p.getPoolId()))
                .toList();
    }

    public List<StakePosition> ownedBy(String owner) {
        return positions.values().stream()
                .filter(p -> owner.equals(p.getOwner()))
                .toList();
    }

    public List<StakePosition> inStakingPool(String stakingPoolId) {
        return positions.values().stream()
                .filter(p -> !p.isDelegation())
                .filter(p -> stakingPoolId.equals(p.getPoolId()))
                .toList();
    }

    public int size() {
        return positions.size();
    }
}
