package com.github.salilvnair.statefuzzer.engine.model;

import java.util.List;

public record LoadedStateModel(StateModel model, List<StateInvariant> invariants) {

    public LoadedStateModel {
        invariants = List.copyOf(invariants);
    }
}
