package com.github.salilvnair.statefuzzer.engine.loader.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InvariantDescription(
        @JsonProperty("name") String name,
        @JsonProperty("expression") String expression,
        @JsonProperty("description") String description,
        @JsonProperty("severity") String severity
) {
}
