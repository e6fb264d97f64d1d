package com.github.salilvnair.statefuzzer.engine.core;

import com.github.salilvnair.statefuzzer.engine.model.StateInvariant;
import com.github.salilvnair.statefuzzer.engine.model.StateModel;

import java.util.List;

public interface StateFuzzerEngine {

    StateFuzzerRun run(StateFuzzerRequest request);

    default StateFuzzerRun run(String target) {
        return run(target, null);
    }

    default StateFuzzerRun run(String target, Integer maxDepth) {
        return run(StateFuzzerRequest.builder().target(target).maxDepth(maxDepth).build());
    }

    default StateFuzzerRun run(StateModel model, List<StateInvariant> invariants, Integer maxDepth) {
        return run(StateFuzzerRequest.builder()
                .model(model)
                .invariants(invariants)
                .maxDepth(maxDepth)
                .build());
    }
}
