package com.github.salilvnair.statefuzzer.engine.model;

import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerConstants;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.function.Predicate;

@Getter
@Builder
public class StateInvariant {

    @NonNull
    private final String name;
    @NonNull
    private final Predicate<ContractState> check;
    private final String description;
    @Builder.Default
    private final String severity = StateFuzzerConstants.DEFAULT_SEVERITY;

    public boolean holds(ContractState state) {
        return check.test(state);
    }
}
