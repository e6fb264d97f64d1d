package com.github.salilvnair.statefuzzer.engine.hook.provider;

import com.github.salilvnair.statefuzzer.engine.model.ExplorationProgress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IterationBudgetHookTest {

    @Test
    void continuesUntilBudgetIsSpent() {
        IterationBudgetHook hook = new IterationBudgetHook(3);

        assertTrue(hook.shouldContinue(new ExplorationProgress(2, 0, 0, 0, 1)));
        assertFalse(hook.shouldContinue(new ExplorationProgress(3, 0, 0, 0, 1)));
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new IterationBudgetHook(0));
    }
}
