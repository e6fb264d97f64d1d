package com.github.salilvnair.statefuzzer.engine.explorer;

import com.github.salilvnair.statefuzzer.engine.action.core.StateAction;
import com.github.salilvnair.statefuzzer.engine.hook.ExplorationHook;
import com.github.salilvnair.statefuzzer.engine.model.ActionResult;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.ExplorationProgress;
import com.github.salilvnair.statefuzzer.engine.model.FuzzResult;
import com.github.salilvnair.statefuzzer.engine.model.StateFinding;
import com.github.salilvnair.statefuzzer.engine.model.StateInvariant;
import com.github.salilvnair.statefuzzer.engine.model.StateModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Bounded depth-first exploration of a {@link StateModel}.
 * <p>
 * Frames {@code (depth, state, trace)} live on an explicit LIFO stack seeded with the
 * initial state. Every popped state is signed for coverage and checked against the
 * invariants in declaration order; the first failure is recorded and the branch stops
 * there. Otherwise, below {@code maxDepth}, the applicable actions are shuffled, cut to
 * {@code maxBranchesPerState} and each one pushes a child frame.
 * <p>
 * Seen signatures feed coverage only. They never prune: a state reached along two
 * traces is expanded twice.
 * <p>
 * One instance per run. All randomness comes from a {@link Random} seeded from the
 * settings at the start of {@link #fuzz()}, so equal seeds give equal results.
 */
@Slf4j
public class StateAwareFuzzer {

    private final StateModel model;
    private final List<StateInvariant> invariants;
    private final ExplorationSettings settings;
    private final List<ExplorationHook> hooks;

    private Set<String> visitedSignatures;
    private List<String> coverage;
    private List<StateFinding> findings;
    private int exploredTraces;

    public StateAwareFuzzer(StateModel model, List<StateInvariant> invariants, ExplorationSettings settings) {
        this(model, invariants, settings, List.of());
    }

    public StateAwareFuzzer(StateModel model,
                            List<StateInvariant> invariants,
                            ExplorationSettings settings,
                            List<ExplorationHook> hooks) {
        this.model = model;
        this.invariants = List.copyOf(invariants);
        this.settings = settings;
        this.hooks = hooks == null ? List.of() : List.copyOf(hooks);
    }

    public FuzzResult fuzz() {
        Random random = new Random(settings.seed());
        visitedSignatures = new HashSet<>();
        coverage = new ArrayList<>();
        findings = new ArrayList<>();
        exploredTraces = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, model.initialState().copy(), List.of()));
        long iterations = 0;
        boolean interrupted = false;

        while (!stack.isEmpty()) {
            if (!shouldContinue(new ExplorationProgress(
                    iterations, exploredTraces, visitedSignatures.size(), findings.size(), stack.size()))) {
                interrupted = true;
                log.info("State exploration stopped by hook after {} iterations, {} frames pending",
                        iterations, stack.size());
                break;
            }
            Frame frame = stack.pop();
            iterations++;

            String signature = StateSignature.of(frame.state());
            boolean firstSeen = visitedSignatures.add(signature);
            if (firstSeen) {
                coverage.add(signature);
            }
            for (ExplorationHook hook : hooks) {
                hook.onStateVisited(frame.depth(), frame.state(), signature, firstSeen);
            }

            Optional<StateFinding> violation = checkInvariants(frame);
            if (violation.isPresent()) {
                recordViolation(violation.get());
                continue;
            }

            if (frame.depth() >= settings.maxDepth()) {
                continue;
            }

            expand(frame, stack, random);
        }

        FuzzResult result = new FuzzResult(
                findings,
                exploredTraces,
                visitedSignatures.size(),
                coverage,
                settings.seed(),
                interrupted);
        for (ExplorationHook hook : hooks) {
            hook.onFinish(result);
        }
        log.info("State exploration finished: seed={}, exploredTraces={}, uniqueStates={}, findings={}",
                settings.seed(), result.exploredTraces(), result.uniqueStates(), result.findings().size());
        return result;
    }

    private void expand(Frame frame, Deque<Frame> stack, Random random) {
        List<StateAction> actions = model.availableActions(frame.state());
        Collections.shuffle(actions, random);
        List<StateAction> selected = actions.subList(0, Math.min(actions.size(), settings.maxBranchesPerState()));
        for (StateAction action : selected) {
            Optional<ActionResult> result = action.run(frame.state(), random);
            if (result.isEmpty()) {
                log.debug("Action {} declined at depth {}", action.name(), frame.depth());
                continue;
            }
            List<ActionResult> nextTrace = new ArrayList<>(frame.trace().size() + 1);
            nextTrace.addAll(frame.trace());
            nextTrace.add(result.get());
            stack.push(new Frame(frame.depth() + 1, result.get().resultingState(), List.copyOf(nextTrace)));
            exploredTraces++;
            log.debug("Pushed {} at depth {}: {}", action.name(), frame.depth() + 1, result.get().note());
        }
    }

    private Optional<StateFinding> checkInvariants(Frame frame) {
        for (StateInvariant invariant : invariants) {
            if (!invariant.holds(frame.state())) {
                return Optional.of(new StateFinding(
                        invariant.getName(),
                        invariant.getDescription(),
                        invariant.getSeverity(),
                        frame.trace(),
                        frame.state().copy()));
            }
        }
        return Optional.empty();
    }

    private void recordViolation(StateFinding finding) {
        findings.add(finding);
        log.info("Invariant {} violated after trace {}", finding.invariant(), finding.actionNames());
        for (ExplorationHook hook : hooks) {
            hook.onViolation(finding);
        }
    }

    private boolean shouldContinue(ExplorationProgress progress) {
        for (ExplorationHook hook : hooks) {
            if (!hook.shouldContinue(progress)) {
                return false;
            }
        }
        return true;
    }

    private record Frame(int depth, ContractState state, List<ActionResult> trace) {
    }
}
