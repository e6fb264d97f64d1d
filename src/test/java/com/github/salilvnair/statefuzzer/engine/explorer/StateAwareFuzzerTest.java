package com.github.salilvnair.statefuzzer.engine.explorer;

import com.github.salilvnair.statefuzzer.engine.action.core.StateAction;
import com.github.salilvnair.statefuzzer.engine.action.provider.FunctionalStateAction;
import com.github.salilvnair.statefuzzer.engine.hook.ExplorationHook;
import com.github.salilvnair.statefuzzer.engine.hook.provider.IterationBudgetHook;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.FuzzResult;
import com.github.salilvnair.statefuzzer.engine.model.StateFinding;
import com.github.salilvnair.statefuzzer.engine.model.StateInvariant;
import com.github.salilvnair.statefuzzer.engine.model.StateModel;
import com.github.salilvnair.statefuzzer.engine.model.StateTransition;
import com.github.salilvnair.statefuzzer.support.TestModels;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.salilvnair.statefuzzer.support.TestConstants.BALANCE;
import static com.github.salilvnair.statefuzzer.support.TestConstants.BONUS_WITHDRAW;
import static com.github.salilvnair.statefuzzer.support.TestConstants.DEPOSIT;
import static com.github.salilvnair.statefuzzer.support.TestConstants.NO_NEGATIVE_BALANCES;
import static com.github.salilvnair.statefuzzer.support.TestConstants.OTHER_SEED;
import static com.github.salilvnair.statefuzzer.support.TestConstants.SEED;
import static com.github.salilvnair.statefuzzer.support.TestConstants.UNLOCKED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateAwareFuzzerTest {

    private static FuzzResult fuzz(StateModel model, List<StateInvariant> invariants,
                                   int maxDepth, int maxBranches, long seed, ExplorationHook... hooks) {
        return new StateAwareFuzzer(model, invariants, new ExplorationSettings(maxDepth, maxBranches, seed),
                List.of(hooks)).fuzz();
    }

    private static StateAction setter(String name, long value) {
        return FunctionalStateAction.builder()
                .name(name)
                .executor((state, params) -> {
                    state.putStorage(BALANCE, value);
                    return new StateTransition(state, null);
                })
                .build();
    }

    @ParameterizedTest
    @ValueSource(longs = {SEED, OTHER_SEED, 0L, 1L, 42L})
    void findsDoubleBonusWithdrawUnderflowForAnySeed(long seed) {
        FuzzResult result = fuzz(TestModels.unlockUnderflowModel(), List.of(TestModels.nonNegativeBalance()), 3, 3, seed);

        assertEquals(1, result.findings().size());
        StateFinding finding = result.findings().get(0);
        assertEquals(NO_NEGATIVE_BALANCES, finding.invariant());
        assertEquals("CRITICAL", finding.severity());
        assertEquals(List.of(DEPOSIT, BONUS_WITHDRAW, BONUS_WITHDRAW), finding.actionNames());
        assertEquals(-12L, finding.stateSnapshot().storageValue(BALANCE));
        assertEquals(seed, result.seed());
        assertFalse(result.interrupted());
    }

    @Test
    void countsTracesAndDistinctStates() {
        FuzzResult result = fuzz(TestModels.unlockUnderflowModel(), List.of(TestModels.nonNegativeBalance()), 3, 3, SEED);

        // root -> deposit -> {deposit, bonus} -> {deposit, bonus} twice
        assertEquals(7, result.exploredTraces());
        assertEquals(6, result.uniqueStates());
        assertEquals(result.uniqueStates(), result.coverage().size());
        assertEquals(result.uniqueStates(), new HashSet<>(result.coverage()).size());
    }

    @Test
    void noFindingsWhenViolationIsBeyondDepth() {
        FuzzResult result = fuzz(TestModels.unlockUnderflowModel(), List.of(TestModels.nonNegativeBalance()), 2, 3, SEED);

        assertTrue(result.findings().isEmpty());
    }

    @Test
    void sameSeedGivesIdenticalResult() {
        StateModel model = TestModels.unlockUnderflowModel();
        List<StateInvariant> invariants = List.of(TestModels.nonNegativeBalance());

        FuzzResult first = fuzz(model, invariants, 4, 2, SEED);
        FuzzResult second = fuzz(model, invariants, 4, 2, SEED);

        assertEquals(first, second);
    }

    @Test
    void revisitedStatesCountOnceButAreStillExpanded() {
        List<String> firstSeen = new ArrayList<>();
        List<Integer> depths = new ArrayList<>();
        ExplorationHook collector = new ExplorationHook() {
            @Override
            public void onStateVisited(int depth, ContractState state, String signature, boolean first) {
                depths.add(depth);
                if (first) {
                    firstSeen.add(signature);
                }
            }
        };

        FuzzResult result = fuzz(TestModels.toggleModel(), List.of(), 3, 6, SEED, collector);

        assertEquals(List.of(0, 1, 2, 3), depths);
        assertEquals(3, result.exploredTraces());
        assertEquals(2, result.uniqueStates());
        assertEquals(firstSeen, result.coverage());
    }

    @Test
    void zeroDepthChecksOnlyTheInitialState() {
        FuzzResult result = fuzz(TestModels.unlockUnderflowModel(), List.of(TestModels.nonNegativeBalance()), 0, 3, SEED);

        assertEquals(0, result.exploredTraces());
        assertEquals(1, result.uniqueStates());
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void violatingInitialStateReportsEmptyTrace() {
        StateModel model = new StateModel(new ContractState(Map.of(BALANCE, -1)), List.of(setter("reset", 0)));

        FuzzResult result = fuzz(model, List.of(TestModels.nonNegativeBalance()), 3, 3, SEED);

        assertEquals(1, result.findings().size());
        assertTrue(result.findings().get(0).trace().isEmpty());
        assertEquals(0, result.exploredTraces());
    }

    @Test
    void branchCapLimitsChildrenPerState() {
        StateModel model = new StateModel(new ContractState(Map.of(BALANCE, 0)),
                List.of(setter("one", 1), setter("two", 2), setter("three", 3)));

        assertEquals(3, fuzz(model, List.of(), 1, 6, SEED).exploredTraces());
        assertEquals(1, fuzz(model, List.of(), 1, 1, SEED).exploredTraces());
        assertEquals(0, fuzz(model, List.of(), 1, 0, SEED).exploredTraces());
    }

    @Test
    void declinedActionsPushNothing() {
        StateAction declining = FunctionalStateAction.builder()
                .name("noop")
                .executor((state, params) -> null)
                .build();
        StateModel model = new StateModel(new ContractState(Map.of(BALANCE, 0)), List.of(declining));

        FuzzResult result = fuzz(model, List.of(), 3, 3, SEED);

        assertEquals(0, result.exploredTraces());
        assertEquals(1, result.uniqueStates());
    }

    @Test
    void onlyFirstFailingInvariantIsReported() {
        StateInvariant first = StateInvariant.builder().name("first").check(state -> false).build();
        StateInvariant second = StateInvariant.builder().name("second").check(state -> false).build();
        StateModel model = new StateModel(new ContractState(Map.of(UNLOCKED, false)), List.of());

        FuzzResult result = fuzz(model, List.of(first, second), 2, 2, SEED);

        assertEquals(1, result.findings().size());
        assertEquals("first", result.findings().get(0).invariant());
        assertEquals("HIGH", result.findings().get(0).severity());
    }

    @Test
    void violatingBranchIsNotExpanded() {
        StateInvariant neverUnlocked = StateInvariant.builder()
                .name("never-unlocked")
                .check(state -> !Boolean.TRUE.equals(state.storageValue(UNLOCKED)))
                .build();

        FuzzResult result = fuzz(TestModels.toggleModel(), List.of(neverUnlocked), 5, 6, SEED);

        assertEquals(1, result.findings().size());
        assertEquals(1, result.exploredTraces());
    }

    @Test
    void iterationBudgetInterruptsTheSearch() {
        FuzzResult result = fuzz(TestModels.unlockUnderflowModel(), List.of(TestModels.nonNegativeBalance()), 3, 3, SEED,
                new IterationBudgetHook(1));

        assertTrue(result.interrupted());
        assertEquals(1, result.uniqueStates());
        assertEquals(1, result.exploredTraces());
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void hooksSeeViolationsAndFinish() {
        List<StateFinding> violations = new ArrayList<>();
        Set<FuzzResult> finished = new HashSet<>();
        ExplorationHook hook = new ExplorationHook() {
            @Override
            public void onViolation(StateFinding finding) {
                violations.add(finding);
            }

            @Override
            public void onFinish(FuzzResult result) {
                finished.add(result);
            }
        };

        FuzzResult result = fuzz(TestModels.unlockUnderflowModel(), List.of(TestModels.nonNegativeBalance()), 3, 3, SEED, hook);

        assertEquals(result.findings(), violations);
        assertEquals(Set.of(result), finished);
    }
}
