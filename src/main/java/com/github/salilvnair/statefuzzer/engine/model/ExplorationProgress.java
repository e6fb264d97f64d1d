package com.github.salilvnair.statefuzzer.engine.model;

/**
 * Counters visible to exploration hooks between stack pops.
 */
public record ExplorationProgress(
        long iterations,
        int exploredTraces,
        int uniqueStates,
        int findings,
        int pendingFrames
) {
}
