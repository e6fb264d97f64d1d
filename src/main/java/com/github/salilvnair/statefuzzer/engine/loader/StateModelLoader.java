package com.github.salilvnair.statefuzzer.engine.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.statefuzzer.config.StateFuzzerConfig;
import com.github.salilvnair.statefuzzer.engine.action.core.StateAction;
import com.github.salilvnair.statefuzzer.engine.action.input.FixedInput;
import com.github.salilvnair.statefuzzer.engine.action.input.InputSpec;
import com.github.salilvnair.statefuzzer.engine.action.input.RangeInput;
import com.github.salilvnair.statefuzzer.engine.action.model.StateUpdateDirective;
import com.github.salilvnair.statefuzzer.engine.action.provider.DeclarativeStateAction;
import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerConstants;
import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerPayloadKey;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerErrorCode;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerException;
import com.github.salilvnair.statefuzzer.engine.expression.ExpressionEvaluator;
import com.github.salilvnair.statefuzzer.engine.loader.model.ActionDescription;
import com.github.salilvnair.statefuzzer.engine.loader.model.InvariantDescription;
import com.github.salilvnair.statefuzzer.engine.loader.model.ModelDescription;
import com.github.salilvnair.statefuzzer.engine.loader.model.StateUpdateDescription;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.engine.model.LoadedStateModel;
import com.github.salilvnair.statefuzzer.engine.model.StateInvariant;
import com.github.salilvnair.statefuzzer.engine.model.StateModel;
import com.github.salilvnair.statefuzzer.engine.update.factory.StateUpdateResolverFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a {@link StateModel} and its invariants from a declarative JSON description.
 * Does no searching. A missing source yields {@link Optional#empty()}; a source that
 * exists but cannot be read as a model raises {@code MODEL_UNPARSEABLE}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateModelLoader {

    private final ObjectMapper mapper;
    private final ExpressionEvaluator evaluator;
    private final StateUpdateResolverFactory updateFactory;
    private final StateFuzzerConfig config;

    public Optional<LoadedStateModel> load(String location) {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        try {
            return load(Path.of(location));
        } catch (InvalidPathException e) {
            log.warn("State model location {} is not a valid path: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Same as {@link #load(String)} but a missing source raises {@code MODEL_NOT_FOUND}.
     */
    public LoadedStateModel require(String location) {
        return load(location).orElseThrow(() -> new StateFuzzerException(
                StateFuzzerErrorCode.MODEL_NOT_FOUND,
                "state model not found at " + location)
                .withMetaData(Map.of(StateFuzzerPayloadKey.SOURCE, String.valueOf(location))));
    }

    public Optional<LoadedStateModel> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return Optional.of(read(in, path.toString()));
        } catch (IOException e) {
            throw unparseable(path.toString(), e.getMessage(), e);
        }
    }

    public LoadedStateModel read(InputStream in, String source) {
        try {
            return build(mapper.readValue(in, ModelDescription.class), source);
        } catch (IOException e) {
            throw unparseable(source, e.getMessage(), e);
        }
    }

    public LoadedStateModel parse(String json, String source) {
        try {
            return build(mapper.readValue(json, ModelDescription.class), source);
        } catch (IOException e) {
            throw unparseable(source, e.getMessage(), e);
        }
    }

    public LoadedStateModel build(ModelDescription description, String source) {
        if (description == null) {
            throw unparseable(source, "empty model document", null);
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(StateFuzzerPayloadKey.SOURCE, source);
        ContractState initialState = new ContractState(
                orEmpty(description.initialStorage()),
                orEmpty(description.initialBalances()),
                metadata);

        List<StateAction> actions = new ArrayList<>();
        for (ActionDescription action : listOrEmpty(description.actions())) {
            actions.add(buildAction(action, source));
        }
        List<StateInvariant> invariants = new ArrayList<>();
        for (InvariantDescription invariant : listOrEmpty(description.invariants())) {
            invariants.add(buildInvariant(invariant, source));
        }
        log.debug("Loaded state model from {}: {} actions, {} invariants", source, actions.size(), invariants.size());
        return new LoadedStateModel(new StateModel(initialState, actions), invariants);
    }

    private StateAction buildAction(ActionDescription description, String source) {
        if (description == null) {
            throw unparseable(source, "actions contains a null entry", null);
        }
        String name = description.name() == null ? StateFuzzerConstants.DEFAULT_ACTION_NAME : description.name();

        Map<String, InputSpec> inputs = new LinkedHashMap<>();
        if (description.inputs() != null) {
            description.inputs().forEach((param, spec) -> inputs.put(param, toInputSpec(name, param, spec, source)));
        }

        List<StateUpdateDirective> updates = new ArrayList<>();
        for (StateUpdateDescription update : listOrEmpty(description.stateUpdates())) {
            updates.add(toDirective(name, update, source));
        }

        if (config.getModel().isValidateExpressionsOnLoad()) {
            validate(description.precondition());
            updates.forEach(update -> validate(update.condition()));
        }
        return new DeclarativeStateAction(name, description.precondition(), inputs, updates, evaluator, updateFactory);
    }

    private InputSpec toInputSpec(String action, String param, JsonNode spec, String source) {
        if (spec != null && spec.isArray() && spec.size() == 2
                && spec.get(0).isNumber() && spec.get(1).isNumber()) {
            long lo = spec.get(0).asLong();
            long hi = spec.get(1).asLong();
            if (lo > hi) {
                throw unparseable(source, "input '" + param + "' of action '" + action
                        + "' has inverted range [" + lo + ", " + hi + "]", null);
            }
            return new RangeInput(lo, hi);
        }
        return new FixedInput(toScalar(spec));
    }

    private StateUpdateDirective toDirective(String action, StateUpdateDescription update, String source) {
        if (update == null || update.target() == null || update.target().isBlank()) {
            throw unparseable(source, "state update of action '" + action + "' has no target", null);
        }
        String op = update.op() == null ? StateFuzzerConstants.DEFAULT_UPDATE_OP : update.op();
        if (!updateFactory.supports(op)) {
            throw unparseable(source, "state update of action '" + action + "' uses unknown op '" + op + "'", null);
        }
        return new StateUpdateDirective(
                update.target(),
                op,
                toScalar(update.value()),
                update.valueFrom(),
                update.condition());
    }

    private StateInvariant buildInvariant(InvariantDescription description, String source) {
        if (description == null) {
            throw unparseable(source, "invariants contains a null entry", null);
        }
        String expression = description.expression();
        if (expression == null || expression.isBlank()) {
            throw unparseable(source, "invariant '" + description.name() + "' has no expression", null);
        }
        if (config.getModel().isValidateExpressionsOnLoad()) {
            validate(expression);
        }
        String severity = description.severity() == null
                ? config.getModel().getDefaultSeverity()
                : description.severity();
        return StateInvariant.builder()
                .name(description.name() == null ? StateFuzzerConstants.DEFAULT_INVARIANT_NAME : description.name())
                .description(description.description() != null ? description.description() : expression)
                .severity(severity.toUpperCase(Locale.ROOT))
                .check(state -> evaluator.test(expression, state.evaluationScope()))
                .build();
    }

    private void validate(String expression) {
        if (expression != null && !expression.isBlank()) {
            evaluator.compile(expression);
        }
    }

    private Object toScalar(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isIntegralNumber()) return node.asLong();
        if (node.isFloatingPointNumber()) return node.asDouble();
        return mapper.convertValue(node, Object.class);
    }

    private static Map<String, Object> orEmpty(Map<String, Object> values) {
        return values == null ? Map.of() : values;
    }

    private static <T> List<T> listOrEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    private static StateFuzzerException unparseable(String source, String reason, Throwable cause) {
        String message = "State model at " + source + " could not be parsed: " + reason;
        StateFuzzerException exception = cause == null
                ? new StateFuzzerException(StateFuzzerErrorCode.MODEL_UNPARSEABLE, message)
                : new StateFuzzerException(StateFuzzerErrorCode.MODEL_UNPARSEABLE, message, cause);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(StateFuzzerPayloadKey.SOURCE, source);
        return exception.withMetaData(meta);
    }
}
