package com.liquidityledger.validator;

import com.liquidityledger.domain.StakePosition;
import com.liquidityledger.domain.ValidatorNode;

import java.util.List;

/**
 * Validator together with every delegation targeting it, captured in one critical section.
 */
public record ValidatorState(ValidatorNode validator, List<StakePosition> delegations) {

    public ValidatorState {
        delegations = List.copyOf(delegations);
    }
}
