package com.github.salilvnair.statefuzzer.engine.action.provider;

import com.github.salilvnair.statefuzzer.engine.action.core.StateAction;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.StateTransition;
import lombok.Builder;
import lombok.NonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.random.RandomGenerator;

/**
 * Action assembled from functions, for models built in code. The executor receives a
 * private copy of the state and may mutate it freely; returning {@code null} declines.
 */
@Builder
public final class FunctionalStateAction implements StateAction {

    @NonNull
    private final String name;

    @Builder.Default
    private final Predicate<ContractState> precondition = state -> true;

    @Builder.Default
    private final BiFunction<ContractState, RandomGenerator, Map<String, Object>> parameterStrategy =
            (state, random) -> Map.of();

    @NonNull
    private final BiFunction<ContractState, Map<String, Object>, StateTransition> executor;

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isApplicable(ContractState state) {
        return precondition.test(state);
    }

    @Override
    public Map<String, Object> generateParameters(ContractState state, RandomGenerator random) {
        Map<String, Object> params = parameterStrategy.apply(state, random);
        return params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
    }

    @Override
    public Optional<StateTransition> apply(ContractState state, Map<String, Object> parameters) {
        return Optional.ofNullable(executor.apply(state.copy(), parameters));
    }
}
