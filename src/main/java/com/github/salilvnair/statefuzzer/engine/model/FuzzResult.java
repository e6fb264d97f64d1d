package com.github.salilvnair.statefuzzer.engine.model;

import java.util.List;

public record FuzzResult(
        List<StateFinding> findings,
        int exploredTraces,
        int uniqueStates,
        List<String> coverage,
        long seed,
        boolean interrupted
) {
    public FuzzResult {
        findings = List.copyOf(findings);
        coverage = List.copyOf(coverage);
    }
}
