package com.github.salilvnair.statefuzzer.engine.loader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionDescription(
        @JsonProperty("name") String name,
        @JsonProperty("precondition") String precondition,
        @JsonProperty("inputs") Map<String, JsonNode> inputs,
        @JsonProperty("state_updates") List<StateUpdateDescription> stateUpdates
) {
}
