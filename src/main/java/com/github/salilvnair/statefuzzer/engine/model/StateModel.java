package com.github.salilvnair.statefuzzer.engine.model;

import com.github.salilvnair.statefuzzer.engine.action.core.StateAction;

import java.util.ArrayList;
import java.util.List;

/**
 * Initial state plus the actions available from it. Declaration order is the lookup
 * order; the explorer shuffles before expanding.
 */
public record StateModel(ContractState initialState, List<StateAction> actions) {

    public StateModel {
        actions = List.copyOf(actions);
    }

    public List<StateAction> availableActions(ContractState state) {
        List<StateAction> available = new ArrayList<>();
        for (StateAction action : actions) {
            if (action.isApplicable(state)) {
                available.add(action);
            }
        }
        return available;
    }
}
