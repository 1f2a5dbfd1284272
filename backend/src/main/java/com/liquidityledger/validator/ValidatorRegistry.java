package com.liquidityledger.validator;

import com.liquidityledger.common.Decimals;
import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.SlashingRecord;
import com.liquidityledger.domain.StakePosition;
import com.liquidityledger.domain.StakePositionBook;
import com.liquidityledger.domain.StakeStatus;
import com.liquidityledger.domain.ValidatorNode;
import com.liquidityledger.domain.ValidatorSlashedEvent;
import com.liquidityledger.domain.ValidatorStatus;
import com.liquidityledger.validator.config.ValidatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validator nodes and slashing. A validator's lock also guards every delegation position targeting it, so a slash
 * and any reader of the validator see either none or all of its effects.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidatorRegistry {

    private final Map<String, ValidatorNode> validators = new ConcurrentHashMap<>();

    private final StakePositionBook stakePositionBook;
    private final EntityLocks locks;
    private final ValidatorProperties validatorProperties;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * Register a validator with performance score 1.0 and status ACTIVE.
     *
     * @param id validator id, or null to generate one
     * @throws ValidatorRegistryException BELOW_MINIMUM_STAKE, COMMISSION_TOO_HIGH, INVALID_VALIDATOR
     */
    public ValidatorNode createValidator(String id, String operator, BigDecimal selfStake, BigDecimal commissionRate) {
        if (operator == null || operator.isBlank()) {
            throw new ValidatorRegistryException(ValidatorRegistryException.INVALID_VALIDATOR, "Operator is required");
        }
        if (selfStake == null || selfStake.compareTo(validatorProperties.getMinSelfStake()) < 0) {
            throw new ValidatorRegistryException(ValidatorRegistryException.BELOW_MINIMUM_STAKE,
                    "Self stake " + selfStake + " below minimum " + validatorProperties.getMinSelfStake());
        }
        if (commissionRate == null || commissionRate.signum() < 0) {
            throw new ValidatorRegistryException(ValidatorRegistryException.INVALID_VALIDATOR,
                    "Commission rate must be non-negative");
        }
        if (commissionRate.compareTo(validatorProperties.getMaxCommissionRate()) > 0) {
            throw new ValidatorRegistryException(ValidatorRegistryException.COMMISSION_TOO_HIGH,
                    "Commission " + commissionRate + " above " + validatorProperties.getMaxCommissionRate());
        }
        Instant now = Instant.now(clock);
        ValidatorNode validator = new ValidatorNode();
        validator.setId(id != null ? id : UUID.randomUUID().toString());
        validator.setOperator(operator);
        validator.setSelfStake(selfStake);
        validator.setCommissionRate(commissionRate);
        validator.setCreatedAt(now);
        validator.setUpdatedAt(now);
        if (validators.putIfAbsent(validator.getId(), validator) != null) {
            throw new ValidatorRegistryException(ValidatorRegistryException.INVALID_VALIDATOR,
                    "Validator already exists: " + validator.getId());
        }
        log.info("Registered validator {} for operator {} with self stake {}", validator.getId(), operator, selfStake);
        return locks.withLock(EntityLocks.validator(validator.getId()), validator::snapshot);
    }

    /**
     * Slash a validator and all its ACTIVE delegations by the same fraction, in one critical section.
     *
     * @param penaltyPct fraction in [0, 1]
     * @throws ValidatorRegistryException VALIDATOR_NOT_FOUND, INVALID_PENALTY
     */
    public SlashingRecord slash(String validatorId, BigDecimal penaltyPct, String reason) {
        if (penaltyPct == null || penaltyPct.signum() < 0 || penaltyPct.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidatorRegistryException(ValidatorRegistryException.INVALID_PENALTY,
                    "Penalty must be within [0, 1]: " + penaltyPct);
        }
        ValidatorNode validator = require(validatorId);

        SlashingRecord slashing = locks.withLock(EntityLocks.validator(validatorId), () -> {
            BigDecimal validatorPenalty = validator.getSelfStake().multiply(penaltyPct);
            List<StakePosition> affected = stakePositionBook.delegationsTo(validatorId).stream()
                    .filter(StakePosition::isActive)
                    .toList();
            BigDecimal delegatorPenalty = BigDecimal.ZERO;
            for (StakePosition delegation : affected) {
                BigDecimal removed = delegation.getAmount().multiply(penaltyPct);
                delegation.setAmount(delegation.getAmount().subtract(removed));
                delegation.setPenaltyApplied(delegation.getPenaltyApplied().add(removed));
                delegation.setStatus(StakeStatus.SLASHED);
                delegatorPenalty = delegatorPenalty.add(removed);
            }
            Instant now = Instant.now(clock);
            validator.setSelfStake(validator.getSelfStake().subtract(validatorPenalty));
            validator.setSlashCount(validator.getSlashCount() + 1);
            validator.setPerformanceScore(validator.getPerformanceScore()
                    .multiply(validatorProperties.getSlashPerformanceFactor(), Decimals.MC));
            validator.setDelegatedStake(validator.getDelegatedStake()
                    .subtract(validator.getDelegatedStake().multiply(penaltyPct)));
            validator.setUpdatedAt(now);
            return new SlashingRecord(validatorId, penaltyPct, reason, validatorPenalty, delegatorPenalty,
                    affected.size(), now);
        });

        log.warn("Validator {} slashed {} ({}): validator penalty {}, {} delegations penalised {}", validatorId,
                penaltyPct, reason, slashing.validatorPenalty(), slashing.affectedDelegations(),
                slashing.delegatorPenalty());
        applicationEventPublisher.publishEvent(new ValidatorSlashedEvent(slashing));
        return slashing;
    }

    public ValidatorNode activate(String validatorId) {
        return changeStatus(validatorId, ValidatorStatus.ACTIVE);
    }

    /** Inactive validators keep existing delegations but reject new ones. */
    public ValidatorNode deactivate(String validatorId) {
        return changeStatus(validatorId, ValidatorStatus.INACTIVE);
    }

    public ValidatorNode getValidator(String validatorId) {
        ValidatorNode validator = require(validatorId);
        return locks.withLock(EntityLocks.validator(validatorId), validator::snapshot);
    }

    public Optional<ValidatorNode> findValidator(String validatorId) {
        return Optional.ofNullable(validatorId).map(validators::get)
                .map(v -> locks.withLock(EntityLocks.validator(v.getId()), v::snapshot));
    }

    /** Validator and its delegations read under the validator's lock. */
    public ValidatorState getValidatorState(String validatorId) {
        ValidatorNode validator = require(validatorId);
        return locks.withLock(EntityLocks.validator(validatorId), () -> new ValidatorState(validator.snapshot(),
                stakePositionBook.delegationsTo(validatorId).stream()
                        .map(StakePosition::snapshot)
                        .sorted(Comparator.comparing(StakePosition::getStakeTime))
                        .toList()));
    }

    public List<ValidatorNode> listValidators() {
        List<ValidatorNode> result = new ArrayList<>();
        for (ValidatorNode validator : validators.values()) {
            result.add(locks.withLock(EntityLocks.validator(validator.getId()), validator::snapshot));
        }
        result.sort(Comparator.comparing(ValidatorNode::getCreatedAt).thenComparing(ValidatorNode::getId));
        return result;
    }

    public long activeValidatorCount() {
        return validators.values().stream().filter(ValidatorNode::isActive).count();
    }

    /**
     * Snapshot of an ACTIVE validator.
     *
     * @throws ValidatorRegistryException VALIDATOR_NOT_FOUND, VALIDATOR_INACTIVE
     */
    public ValidatorNode requireActive(String validatorId) {
        ValidatorNode snapshot = getValidator(validatorId);
        if (!snapshot.isActive()) {
            throw new ValidatorRegistryException(ValidatorRegistryException.VALIDATOR_INACTIVE,
                    "Validator " + validatorId + " is inactive");
        }
        return snapshot;
    }

    /**
     * Apply a delegation change to the validator's delegated stake. The caller must hold the validator's lock and
     * update the matching delegation position in the same critical section.
     */
    public void adjustDelegatedStake(String validatorId, BigDecimal delta) {
        String key = EntityLocks.validator(validatorId);
        if (!locks.isHeldByCurrentThread(key)) {
            throw new IllegalStateException("Lock " + key + " not held by caller");
        }
        ValidatorNode validator = require(validatorId);
        validator.setDelegatedStake(validator.getDelegatedStake().add(delta).max(BigDecimal.ZERO));
        validator.setUpdatedAt(Instant.now(clock));
    }

    private ValidatorNode changeStatus(String validatorId, ValidatorStatus status) {
        ValidatorNode validator = require(validatorId);
        ValidatorNode snapshot = locks.withLock(EntityLocks.validator(validatorId), () -> {
            validator.setStatus(status);
            validator.setUpdatedAt(Instant.now(clock));
            return validator.snapshot();
        });
        log.info("Validator {} is now {}", validatorId, status);
        return snapshot;
    }

    private ValidatorNode require(String validatorId) {
        ValidatorNode validator = validatorId == null ? null : validators.get(validatorId);
        if (validator == null) {
            throw new ValidatorRegistryException(ValidatorRegistryException.VALIDATOR_NOT_FOUND,
                    "Validator not found: " + validatorId);
        }
        return validator;
    }
}
