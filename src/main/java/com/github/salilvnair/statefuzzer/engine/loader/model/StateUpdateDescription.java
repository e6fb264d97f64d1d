package com.github.salilvnair.statefuzzer.engine.loader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StateUpdateDescription(
        @JsonProperty("target") String target,
        @JsonProperty("op") String op,
        @JsonProperty("value") JsonNode value,
        @JsonProperty("value_from") String valueFrom,
        @JsonProperty("condition") String condition
) {
}
