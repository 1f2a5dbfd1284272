package com.liquidityledger.validator;

import com.liquidityledger.common.EntityLocks;
import com.liquidityledger.domain.SlashingRecord;
import com.liquidityledger.domain.StakeKind;
import com.liquidityledger.domain.StakePosition;
import com.liquidityledger.domain.StakePositionBook;
import com.liquidityledger.domain.StakeStatus;
import com.liquidityledger.domain.ValidatorNode;
import com.liquidityledger.domain.ValidatorSlashedEvent;
import com.liquidityledger.domain.ValidatorStatus;
import com.liquidityledger.pricing.TokenRegistry;
import com.liquidityledger.staking.RewardCalculator;
import com.liquidityledger.staking.StakingLedger;
import com.liquidityledger.staking.config.StakingProperties;
import com.liquidityledger.support.MutableClock;
import com.liquidityledger.validator.config.ValidatorProperties;
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
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ValidatorRegistryTest {

    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    MutableClock clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));
    ValidatorRegistry validatorRegistry;
    StakingLedger stakingLedger;

    @BeforeEach
    void setUp() {
        TokenRegistry tokenRegistry = new TokenRegistry();
        StakePositionBook book = new StakePositionBook();
        EntityLocks locks = new EntityLocks();
        validatorRegistry = new ValidatorRegistry(book, locks, new ValidatorProperties(), applicationEventPublisher, clock);
        stakingLedger = new StakingLedger(book, validatorRegistry, tokenRegistry, new RewardCalculator(), locks,
                new StakingProperties(), applicationEventPublisher, clock);
    }

    @Test
    @DisplayName("5% slash of self 100 and delegation 500 leaves 95 and 475")
    void slashesValidatorAndDelegations() {
        validatorRegistry.createValidator("v1", "op", new BigDecimal("100"), new BigDecimal("0.10"));
        StakePosition delegation = stakingLedger.delegate("bob", "v1", new BigDecimal("500"));

        SlashingRecord slashing = validatorRegistry.slash("v1", new BigDecimal("0.05"), "double signing");

        assertThat(slashing.validatorPenalty()).isEqualByComparingTo("5");
        assertThat(slashing.delegatorPenalty()).isEqualByComparingTo("25");
        assertThat(slashing.affectedDelegations()).isEqualTo(1);
        ValidatorNode validator = validatorRegistry.getValidator("v1");
        assertThat(validator.getSelfStake()).isEqualByComparingTo("95");
        assertThat(validator.getDelegatedStake()).isEqualByComparingTo("475");
        assertThat(validator.getSlashCount()).isEqualTo(1);
        assertThat(validator.getPerformanceScore()).isEqualByComparingTo("0.9");
        StakePosition slashed = stakingLedger.getPosition(delegation.getId());
        assertThat(slashed.getAmount()).isEqualByComparingTo("475");
        assertThat(slashed.getPenaltyApplied()).isEqualByComparingTo("25");
        assertThat(slashed.getStatus()).isEqualTo(StakeStatus.SLASHED);

        verify(applicationEventPublisher).publishEvent(new ValidatorSlashedEvent(slashing));
    }

    @Test
    @DisplayName("only ACTIVE delegations are slashed")
    void unbondingDelegationsAreSpared() {
        validatorRegistry.createValidator("v1", "op", new BigDecimal("100"), new BigDecimal("0.10"));
        StakePosition leaving = stakingLedger.delegate("bob", "v1", new BigDecimal("100"));
        stakingLedger.delegate("carol", "v1", new BigDecimal("100"));
        clock.advance(new StakingProperties().getUnbondingPeriod());
        stakingLedger.unstake(leaving.getId(), new BigDecimal("50"));

        SlashingRecord slashing = validatorRegistry.slash("v1", new BigDecimal("0.10"), "downtime");

        assertThat(slashing.affectedDelegations()).isEqualTo(1);
        assertThat(stakingLedger.getPosition(leaving.getId()).getAmount()).isEqualByComparingTo("50");
        assertThat(stakingLedger.getPosition(leaving.getId()).getStatus()).isEqualTo(StakeStatus.UNBONDING);
    }

    @Test
    void rejectsPenaltyOutsideUnitInterval() {
        validatorRegistry.createValidator("v1", "op", new BigDecimal("100"), new BigDecimal("0.10"));

        assertThatThrownBy(() -> validatorRegistry.slash("v1", new BigDecimal("1.01"), "x"))
                .isInstanceOf(ValidatorRegistryException.class)
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.INVALID_PENALTY);
        assertThatThrownBy(() -> validatorRegistry.slash("v1", new BigDecimal("-0.1"), "x"))
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.INVALID_PENALTY);
        assertThatThrownBy(() -> validatorRegistry.slash("nope", new BigDecimal("0.1"), "x"))
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.VALIDATOR_NOT_FOUND);
        assertThat(validatorRegistry.getValidator("v1").getSelfStake()).isEqualByComparingTo("100");
        verify(applicationEventPublisher, never()).publishEvent(any(ValidatorSlashedEvent.class));
    }

    @Test
    void rejectsInvalidValidators() {
        assertThatThrownBy(() -> validatorRegistry.createValidator(null, "op", new BigDecimal("31"), BigDecimal.ZERO))
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.BELOW_MINIMUM_STAKE);
        assertThatThrownBy(() -> validatorRegistry.createValidator(null, "op", new BigDecimal("32"), new BigDecimal("0.21")))
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.COMMISSION_TOO_HIGH);
        assertThatThrownBy(() -> validatorRegistry.createValidator(null, " ", new BigDecimal("32"), BigDecimal.ZERO))
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.INVALID_VALIDATOR);

        ValidatorNode created = validatorRegistry.createValidator(null, "op", new BigDecimal("32"), new BigDecimal("0.20"));
        assertThat(created.getStatus()).isEqualTo(ValidatorStatus.ACTIVE);
        assertThat(created.getPerformanceScore()).isEqualByComparingTo("1");
        assertThat(validatorRegistry.listValidators()).hasSize(1);
    }

    @Test
    void statusChanges() {
        validatorRegistry.createValidator("v1", "op", new BigDecimal("100"), new BigDecimal("0.10"));

        assertThat(validatorRegistry.deactivate("v1").getStatus()).isEqualTo(ValidatorStatus.INACTIVE);
        assertThat(validatorRegistry.activeValidatorCount()).isZero();
        assertThatThrownBy(() -> validatorRegistry.requireActive("v1"))
                .extracting("errorCode").isEqualTo(ValidatorRegistryException.VALIDATOR_INACTIVE);
        assertThat(validatorRegistry.activate("v1").getStatus()).isEqualTo(ValidatorStatus.ACTIVE);
        assertThat(validatorRegistry.findValidator("v1")).isPresent();
        assertThat(validatorRegistry.findValidator("v2")).isEmpty();
    }

    @Test
    void adjustingDelegatedStakeRequiresTheValidatorLock() {
        validatorRegistry.createValidator("v1", "op", new BigDecimal("100"), new BigDecimal("0.10"));

        assertThatThrownBy(() -> validatorRegistry.adjustDelegatedStake("v1", BigDecimal.TEN))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("readers never observe a half-applied slash")
    void slashIsAtomicForReaders() throws Exception {
        validatorRegistry.createValidator("v1", "op", new BigDecimal("100"), new BigDecimal("0.10"));
        for (int i = 0; i < 20; i++) {
            stakingLedger.delegate("d" + i, "v1", new BigDecimal("50"));
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicBoolean done = new AtomicBoolean();
        CountDownLatch readersStarted = new CountDownLatch(3);
        ConcurrentLinkedQueue<String> violations = new ConcurrentLinkedQueue<>();
        try {
            List<Future<?>> readers = List.of(
                    pool.submit(() -> read(done, readersStarted, violations)),
                    pool.submit(() -> read(done, readersStarted, violations)),
                    pool.submit(() -> read(done, readersStarted, violations)));
            readersStarted.await(5, TimeUnit.SECONDS);
            validatorRegistry.slash("v1", new BigDecimal("0.5"), "equivocation");
            done.set(true);
            for (Future<?> reader : readers) {
                reader.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(violations).isEmpty();
        assertThat(validatorRegistry.getValidatorState("v1").delegations())
                .allSatisfy(d -> assertThat(d.getStatus()).isEqualTo(StakeStatus.SLASHED));
    }

    private void read(AtomicBoolean done, CountDownLatch started, ConcurrentLinkedQueue<String> violations) {
        started.countDown();
        do {
            ValidatorState state = validatorRegistry.getValidatorState("v1");
            boolean before = state.validator().getSelfStake().compareTo(new BigDecimal("100")) == 0;
            BigDecimal expectedAmount = before ? new BigDecimal("50") : new BigDecimal("25");
            StakeStatus expectedStatus = before ? StakeStatus.ACTIVE : StakeStatus.SLASHED;
            BigDecimal sum = BigDecimal.ZERO;
            for (StakePosition delegation : state.delegations()) {
                if (delegation.getAmount().compareTo(expectedAmount) != 0 || delegation.getStatus() != expectedStatus) {
                    violations.add("mixed state: " + delegation.getId());
                }
                sum = sum.add(delegation.getAmount());
            }
            if (sum.compareTo(state.validator().getDelegatedStake()) != 0) {
                violations.add("delegated stake " + state.validator().getDelegatedStake() + " != " + sum);
            }
            assertThat(state.delegations()).extracting(StakePosition::getKind)
                    .containsOnly(StakeKind.VALIDATOR_DELEGATION);
        } while (!done.get());
    }
}
