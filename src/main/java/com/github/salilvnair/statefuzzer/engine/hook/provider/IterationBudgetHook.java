package com.github.salilvnair.statefuzzer.engine.hook.provider;

import com.github.salilvnair.statefuzzer.engine.hook.ExplorationHook;
import com.github.salilvnair.statefuzzer.engine.model.ExplorationProgress;

public class IterationBudgetHook implements ExplorationHook {

    private final long maxIterations;

    public IterationBudgetHook(long maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive but was " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    @Override
    public boolean shouldContinue(ExplorationProgress progress) {
        return progress.iterations() < maxIterations;
    }
}
