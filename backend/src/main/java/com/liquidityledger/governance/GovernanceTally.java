package com.liquidityledger.governance;

import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.StakePosition;
import com.liquidityledger.domain.StakePositionBook;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Voting power derived from staking. Reads positions under their own locks; never mutates them.
 */
@Service
@RequiredArgsConstructor
public class GovernanceTally {

    private final StakePositionBook stakePositionBook;
    private final EntityLocks locks;

    /** Sum of governance power over the owner's ACTIVE positions. */
    public BigDecimal votingPower(String owner) {
        BigDecimal power = BigDecimal.ZERO;
        for (StakePosition position : stakePositionBook.ownedBy(owner)) {
            BigDecimal contribution = locks.withLock(StakePositionBook.lockKeyFor(position),
                    () -> position.isActive() ? position.getGovernancePower() : BigDecimal.ZERO);
            power = power.add(contribution);
        }
        return power;
    }
}
