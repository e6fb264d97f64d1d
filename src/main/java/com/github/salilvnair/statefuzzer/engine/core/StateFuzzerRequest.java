package com.github.salilvnair.statefuzzer.engine.core;

import com.github.salilvnair.statefuzzer.engine.hook.ExplorationHook;
import com.github.salilvnair.statefuzzer.engine.model.StateInvariant;
import com.github.salilvnair.statefuzzer.engine.model.StateModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One exploration run. Either {@code model} and {@code invariants} are given, or the
 * model is loaded from {@code target}. Unset bounds fall back to configuration.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class StateFuzzerRequest {
    private String target;
    private StateModel model;
    private List<StateInvariant> invariants;
    private Integer maxDepth;
    private Integer maxBranchesPerState;
    private Long seed;
    @Builder.Default
    private List<ExplorationHook> hooks = new ArrayList<>();
}
