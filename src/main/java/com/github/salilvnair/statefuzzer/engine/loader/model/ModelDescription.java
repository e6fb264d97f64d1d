package com.github.salilvnair.statefuzzer.engine.loader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelDescription(
        @JsonProperty("initial_storage") Map<String, Object> initialStorage,
        @JsonProperty("initial_balances") Map<String, Object> initialBalances,
        @JsonProperty("actions") List<ActionDescription> actions,
        @JsonProperty("invariants") List<InvariantDescription> invariants
) {
}
