package com.github.salilvnair.statefuzzer.engine.provider;

import com.github.salilvnair.statefuzzer.config.StateFuzzerConfig;
import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerPayloadKey;
import com.github.salilvnair.statefuzzer.engine.core.StateFuzzerEngine;
import com.github.salilvnair.statefuzzer.engine.core.StateFuzzerRequest;
import com.github.salilvnair.statefuzzer.engine.core.StateFuzzerRun;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerErrorCode;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerException;
import com.github.salilvnair.statefuzzer.engine.explorer.ExplorationSettings;
import com.github.salilvnair.statefuzzer.engine.explorer.StateAwareFuzzer;
import com.github.salilvnair.statefuzzer.engine.finding.NormalizedFinding;
import com.github.salilvnair.statefuzzer.engine.finding.StateFindingTranslator;
import com.github.salilvnair.statefuzzer.engine.hook.ExplorationHook;
import com.github.salilvnair.statefuzzer.engine.hook.provider.IterationBudgetHook;
import com.github.salilvnair.statefuzzer.engine.hook.provider.WallClockBudgetHook;
import com.github.salilvnair.statefuzzer.engine.loader.StateModelLoader;
import com.github.salilvnair.statefuzzer.engine.model.FuzzResult;
import com.github.salilvnair.statefuzzer.engine.model.LoadedStateModel;
import com.github.salilvnair.statefuzzer.engine.model.StateInvariant;
import com.github.salilvnair.statefuzzer.engine.model.StateModel;
import com.github.salilvnair.statefuzzer.engine.model.ToolResult;
import com.github.salilvnair.statefuzzer.util.JsonUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point used by the scan orchestration. Missing or unparseable model sources and
 * operand type mismatches come back as a failed {@link ToolResult}; unsupported
 * expressions propagate.
 */
@Slf4j
@Component
public class DefaultStateFuzzerEngine implements StateFuzzerEngine {

    // reported as a failed run; every other error propagates
    private static final Set<String> MODEL_FAILURES = Set.of(
            StateFuzzerErrorCode.MODEL_NOT_FOUND.name(),
            StateFuzzerErrorCode.MODEL_UNPARSEABLE.name(),
            StateFuzzerErrorCode.EXPRESSION_TYPE_MISMATCH.name());

    private final StateFuzzerConfig config;
    private final StateModelLoader loader;
    private final StateFindingTranslator translator;
    private final List<ExplorationHook> sharedHooks;

    @Autowired
    public DefaultStateFuzzerEngine(StateFuzzerConfig config,
                                    StateModelLoader loader,
                                    StateFindingTranslator translator,
                                    ObjectProvider<ExplorationHook> sharedHooks) {
        this(config, loader, translator, sharedHooks.orderedStream().toList());
    }

    public DefaultStateFuzzerEngine(StateFuzzerConfig config,
                                    StateModelLoader loader,
                                    StateFindingTranslator translator,
                                    List<ExplorationHook> sharedHooks) {
        this.config = config;
        this.loader = loader;
        this.translator = translator;
        this.sharedHooks = sharedHooks == null ? List.of() : List.copyOf(sharedHooks);
    }

    @Override
    public StateFuzzerRun run(StateFuzzerRequest request) {
        long startedAt = System.nanoTime();
        StateModel model = request.getModel();
        List<StateInvariant> invariants = request.getInvariants();

        if (model == null || invariants == null) {
            LoadedStateModel loaded;
            try {
                loaded = loader.require(request.getTarget());
            } catch (StateFuzzerException e) {
                if (!isModelFailure(e)) {
                    throw e;
                }
                log.warn("State model at {} is unusable ({}): {}", request.getTarget(), e.getErrorCode(), e.getMessage());
                return failure(e.getMessage());
            }
            model = loaded.model();
            invariants = loaded.invariants();
        }

        ExplorationSettings settings = resolveSettings(request);
        log.info("Starting state exploration of {}: maxDepth={}, maxBranchesPerState={}, seed={}",
                request.getTarget() == null ? "in-memory model" : request.getTarget(),
                settings.maxDepth(), settings.maxBranchesPerState(), settings.seed());

        FuzzResult result;
        try {
            result = new StateAwareFuzzer(model, invariants, settings, resolveHooks(request)).fuzz();
        } catch (StateFuzzerException e) {
            if (!isModelFailure(e)) {
                throw e;
            }
            log.warn("State exploration aborted ({}): {}", e.getErrorCode(), e.getMessage());
            return failure(e.getMessage());
        }
        List<NormalizedFinding> findings = translator.translate(result);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put(StateFuzzerPayloadKey.EXPLORED_TRACES, result.exploredTraces());
        summary.put(StateFuzzerPayloadKey.UNIQUE_STATES, result.uniqueStates());
        summary.put(StateFuzzerPayloadKey.COVERAGE, result.coverage());
        summary.put(StateFuzzerPayloadKey.FINDINGS, findings.size());
        summary.put(StateFuzzerPayloadKey.SEED, result.seed());
        summary.put(StateFuzzerPayloadKey.MAX_DEPTH, settings.maxDepth());
        summary.put(StateFuzzerPayloadKey.INTERRUPTED, result.interrupted());

        double durationSeconds = (System.nanoTime() - startedAt) / 1_000_000_000.0d;
        ToolResult toolResult = new ToolResult(true, JsonUtil.toJson(summary), null, durationSeconds);
        return new StateFuzzerRun(toolResult, findings, result);
    }

    private ExplorationSettings resolveSettings(StateFuzzerRequest request) {
        StateFuzzerConfig.Explorer explorer = config.getExplorer();
        int maxDepth = request.getMaxDepth() != null ? request.getMaxDepth() : explorer.getMaxDepth();
        int maxBranches = request.getMaxBranchesPerState() != null
                ? request.getMaxBranchesPerState()
                : explorer.getMaxBranchesPerState();
        long seed;
        if (request.getSeed() != null) {
            seed = request.getSeed();
        } else if (explorer.getSeed() != null) {
            seed = explorer.getSeed();
        } else {
            seed = new SecureRandom().nextLong();
        }
        return new ExplorationSettings(maxDepth, maxBranches, seed);
    }

    private List<ExplorationHook> resolveHooks(StateFuzzerRequest request) {
        List<ExplorationHook> hooks = new ArrayList<>(sharedHooks);
        if (request.getHooks() != null) {
            hooks.addAll(request.getHooks());
        }
        StateFuzzerConfig.Explorer explorer = config.getExplorer();
        if (explorer.getMaxIterations() > 0) {
            hooks.add(new IterationBudgetHook(explorer.getMaxIterations()));
        }
        if (explorer.getTimeBudget() != null) {
            hooks.add(new WallClockBudgetHook(explorer.getTimeBudget()));
        }
        return hooks;
    }

    private static boolean isModelFailure(StateFuzzerException e) {
        return MODEL_FAILURES.contains(e.getErrorCode());
    }

    private StateFuzzerRun failure(String error) {
        return new StateFuzzerRun(ToolResult.failure(error), List.of(), null);
    }
}
