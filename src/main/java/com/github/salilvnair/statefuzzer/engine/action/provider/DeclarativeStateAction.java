package com.github.salilvnair.statefuzzer.engine.action.provider;

import com.github.salilvnair.statefuzzer.engine.action.core.StateAction;
import com.github.salilvnair.statefuzzer.engine.action.input.InputSpec;
import com.github.salilvnair.statefuzzer.engine.action.model.StateUpdateDirective;
import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerConstants;
import com.github.salilvnair.statefuzzer.engine.expression.ExpressionEvaluator;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.StateTransition;
import com.github.salilvnair.statefuzzer.engine.update.factory.StateUpdateResolverFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Action interpreted from a model description: a precondition expression, parameter
 * specs and an ordered list of guarded storage updates.
 */
public final class DeclarativeStateAction implements StateAction {

    private final String name;
    private final String precondition;
    private final Map<String, InputSpec> inputs;
    private final List<StateUpdateDirective> updates;
    private final ExpressionEvaluator evaluator;
    private final StateUpdateResolverFactory updateFactory;

    public DeclarativeStateAction(String name,
                                  String precondition,
                                  Map<String, InputSpec> inputs,
                                  List<StateUpdateDirective> updates,
                                  ExpressionEvaluator evaluator,
                                  StateUpdateResolverFactory updateFactory) {
        this.name = name;
        this.precondition = precondition;
        this.inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        this.updates = updates == null ? List.of() : List.copyOf(updates);
        this.evaluator = evaluator;
        this.updateFactory = updateFactory;
    }

    @Override
    public String name() {
        return name;
    }

    public String precondition() {
        return precondition;
    }

    public List<StateUpdateDirective> updates() {
        return updates;
    }

    @Override
    public boolean isApplicable(ContractState state) {
        if (precondition == null || precondition.isBlank()) {
            return true;
        }
        return evaluator.test(precondition, state.evaluationScope());
    }

    @Override
    public Map<String, Object> generateParameters(ContractState state, RandomGenerator random) {
        Map<String, Object> params = new LinkedHashMap<>();
        inputs.forEach((param, spec) -> params.put(param, spec.generate(random)));
        return params;
    }

    @Override
    public Optional<StateTransition> apply(ContractState state, Map<String, Object> parameters) {
        ContractState next = state.copy();
        List<String> notes = new ArrayList<>();
        for (StateUpdateDirective update : updates) {
            if (update.guarded()
                    && !evaluator.test(update.condition(), next.guardScope(parameters))) {
                continue;
            }
            Object operand = update.readsParameter() ? parameters.get(update.valueFrom()) : update.value();
            Object current = next.storageValue(update.target());
            next.putStorage(update.target(), updateFactory.require(update.op()).resolve(current, operand));
            notes.add(update.target() + StateFuzzerConstants.NOTE_ASSIGNMENT + next.storageValue(update.target()));
        }
        String note = notes.isEmpty() ? null : String.join(StateFuzzerConstants.NOTE_SEPARATOR, notes);
        return Optional.of(new StateTransition(next, note));
    }
}
