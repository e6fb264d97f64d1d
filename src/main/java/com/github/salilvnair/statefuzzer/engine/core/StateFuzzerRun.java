package com.github.salilvnair.statefuzzer.engine.core;

import com.github.salilvnair.statefuzzer.engine.finding.NormalizedFinding;
import com.github.salilvnair.statefuzzer.engine.model.FuzzResult;
import com.github.salilvnair.statefuzzer.engine.model.ToolResult;

import java.util.List;

/**
 * @param fuzzResult raw search result, {@code null} when the model could not be loaded
 */
public record StateFuzzerRun(
        ToolResult result,
        List<NormalizedFinding> findings,
        FuzzResult fuzzResult
) {
    public StateFuzzerRun {
        findings = List.copyOf(findings);
    }
}
