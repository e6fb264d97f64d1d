package com.github.salilvnair.statefuzzer.engine.action.core;

import com.github.salilvnair.statefuzzer.engine.model.ActionResult;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.StateTransition;

import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * A named, conditionally applicable state transition.
 * <p>
 * {@link #apply} must be a pure function of its arguments: it works on its own copy of
 * the state and never mutates the one it receives. Randomness comes only from the
 * generator passed to {@link #generateParameters}.
 */
public interface StateAction {

    String name();

    boolean isApplicable(ContractState state);

    Map<String, Object> generateParameters(ContractState state, RandomGenerator random);

    /**
     * @return the transition, or empty when the action declines to fire for these inputs
     */
    Optional<StateTransition> apply(ContractState state, Map<String, Object> parameters);

    default Optional<ActionResult> run(ContractState state, RandomGenerator random) {
        if (!isApplicable(state)) {
            return Optional.empty();
        }
        Map<String, Object> parameters = generateParameters(state, random);
        return apply(state, parameters)
                .map(transition -> new ActionResult(name(), parameters, transition.state(), transition.note()));
    }
}
