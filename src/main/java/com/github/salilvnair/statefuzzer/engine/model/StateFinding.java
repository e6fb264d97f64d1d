package com.github.salilvnair.statefuzzer.engine.model;

import java.util.List;

/**
 * An invariant violation together with the trace that reproduces it.
 */
public record StateFinding(
        String invariant,
        String description,
        String severity,
        List<ActionResult> trace,
        ContractState stateSnapshot
) {
    public StateFinding {
        trace = List.copyOf(trace);
    }

    public List<String> actionNames() {
        return trace.stream().map(ActionResult::name).toList();
    }
}
