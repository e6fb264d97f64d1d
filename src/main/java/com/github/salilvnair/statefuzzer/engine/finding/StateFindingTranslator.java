package com.github.salilvnair.statefuzzer.engine.finding;

import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerConstants;
import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerPayloadKey;
import com.github.salilvnair.statefuzzer.engine.model.ActionResult;
import com.github.salilvnair.statefuzzer.engine.model.FuzzResult;
import com.github.salilvnair.statefuzzer.engine.model.StateFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class StateFindingTranslator {

    public List<NormalizedFinding> translate(FuzzResult result) {
        List<NormalizedFinding> normalized = new ArrayList<>(result.findings().size());
        for (StateFinding finding : result.findings()) {
            normalized.add(toNormalized(finding, result));
        }
        return normalized;
    }

    public NormalizedFinding toNormalized(StateFinding finding) {
        return toNormalized(finding, null);
    }

    public NormalizedFinding toNormalized(StateFinding finding, FuzzResult run) {
        List<Map<String, Object>> steps = new ArrayList<>(finding.trace().size());
        for (ActionResult step : finding.trace()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(StateFuzzerPayloadKey.ACTION, step.name());
            entry.put(StateFuzzerPayloadKey.PARAMETERS, step.parameters());
            entry.put(StateFuzzerPayloadKey.NOTE, step.note());
            entry.put(StateFuzzerPayloadKey.STATE, step.resultingState().storageSnapshot());
            steps.add(entry);
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(StateFuzzerPayloadKey.TRACE, steps);
        raw.put(StateFuzzerPayloadKey.SNAPSHOT, finding.stateSnapshot().storageSnapshot());

        NormalizedFinding.NormalizedFindingBuilder builder = NormalizedFinding.builder()
                .tool(StateFuzzerConstants.TOOL_NAME)
                .title(StateFuzzerConstants.TITLE_PREFIX + finding.invariant())
                .description(finding.description())
                .severity(finding.severity())
                .category(StateFuzzerConstants.CATEGORY_STATE_INVARIANT)
                .raw(raw);
        if (run != null) {
            Map<String, Object> coverage = new LinkedHashMap<>();
            coverage.put(StateFuzzerPayloadKey.EXPLORED_TRACES, run.exploredTraces());
            coverage.put(StateFuzzerPayloadKey.UNIQUE_STATES, run.uniqueStates());
            builder.inputSeed(String.valueOf(run.seed())).coverage(coverage);
        }
        return builder.build();
    }
}
