package com.github.salilvnair.statefuzzer.engine.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ActionResult(
        String name,
        Map<String, Object> parameters,
        ContractState resultingState,
        String note
) {
    public ActionResult {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
