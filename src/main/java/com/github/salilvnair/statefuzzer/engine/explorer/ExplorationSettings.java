package com.github.salilvnair.statefuzzer.engine.explorer;

/**
 * Search bounds and the seed of the run's random source.
 */
public record ExplorationSettings(int maxDepth, int maxBranchesPerState, long seed) {

    public ExplorationSettings {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0 but was " + maxDepth);
        }
        if (maxBranchesPerState < 0) {
            throw new IllegalArgumentException("maxBranchesPerState must be >= 0 but was " + maxBranchesPerState);
        }
    }
}
