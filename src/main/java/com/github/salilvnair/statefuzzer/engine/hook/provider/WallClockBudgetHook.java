package com.github.salilvnair.statefuzzer.engine.hook.provider;

import com.github.salilvnair.statefuzzer.engine.hook.ExplorationHook;
import com.github.salilvnair.statefuzzer.engine.model.ExplorationProgress;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Stops the search once the budget has elapsed. The clock starts on the first check,
 * so one instance serves exactly one run.
 */
public class WallClockBudgetHook implements ExplorationHook {

    private final Duration budget;
    private final Clock clock;
    private Instant deadline;

    public WallClockBudgetHook(Duration budget) {
        this(budget, Clock.systemUTC());
    }

    public WallClockBudgetHook(Duration budget, Clock clock) {
        if (budget == null || budget.isNegative()) {
            throw new IllegalArgumentException("time budget must be a non-negative duration");
        }
        this.budget = budget;
        this.clock = clock;
    }

    @Override
    public boolean shouldContinue(ExplorationProgress progress) {
        Instant now = clock.instant();
        if (deadline == null) {
            deadline = now.plus(budget);
        }
        return now.isBefore(deadline);
    }
}
