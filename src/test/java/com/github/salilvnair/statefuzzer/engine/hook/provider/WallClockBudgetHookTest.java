package com.github.salilvnair.statefuzzer.engine.hook.provider;

import com.github.salilvnair.statefuzzer.engine.model.ExplorationProgress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WallClockBudgetHookTest {

    private static final Instant START = Instant.parse("2024-06-11T10:00:00Z");
    private static final ExplorationProgress PROGRESS = new ExplorationProgress(0, 0, 0, 0, 1);

    @Mock
    private Clock clock;

    @Test
    void budgetStartsAtFirstCheckAndExpires() {
        when(clock.instant()).thenReturn(START, START.plusSeconds(4), START.plusSeconds(5));
        WallClockBudgetHook hook = new WallClockBudgetHook(Duration.ofSeconds(5), clock);

        assertTrue(hook.shouldContinue(PROGRESS));
        assertTrue(hook.shouldContinue(PROGRESS));
        assertFalse(hook.shouldContinue(PROGRESS));
    }

    @Test
    void rejectsNegativeBudget() {
        assertThrows(IllegalArgumentException.class, () -> new WallClockBudgetHook(Duration.ofSeconds(-1)));
    }
}
