package com.github.salilvnair.statefuzzer.engine.hook;

import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.ExplorationProgress;
import com.github.salilvnair.statefuzzer.engine.model.FuzzResult;
import com.github.salilvnair.statefuzzer.engine.model.StateFinding;

/**
 * Callbacks around the exploration loop. {@link #shouldContinue} is consulted before every
 * stack pop and is the place to enforce iteration or wall-clock budgets.
 */
public interface ExplorationHook {

    default boolean shouldContinue(ExplorationProgress progress) {
        return true;
    }

    default void onStateVisited(int depth, ContractState state, String signature, boolean firstSeen) {
    }

    default void onViolation(StateFinding finding) {
    }

    default void onFinish(FuzzResult result) {
    }
}
