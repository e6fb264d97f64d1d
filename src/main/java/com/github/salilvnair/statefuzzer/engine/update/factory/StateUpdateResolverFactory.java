package com.github.salilvnair.statefuzzer.engine.update.factory;

import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerErrorCode;
import com.github.salilvnair.statefuzzer.engine.exception.StateFuzzerException;
import com.github.salilvnair.statefuzzer.engine.update.core.StateUpdateResolver;
import com.github.salilvnair.statefuzzer.engine.update.provider.AddStateUpdateResolver;
import com.github.salilvnair.statefuzzer.engine.update.provider.SetStateUpdateResolver;
import com.github.salilvnair.statefuzzer.engine.update.provider.SubStateUpdateResolver;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class StateUpdateResolverFactory {

    private final Map<String, StateUpdateResolver> resolvers;

    public StateUpdateResolverFactory(List<StateUpdateResolver> resolvers) {
        this.resolvers = resolvers.stream()
                .collect(Collectors.toMap(r -> r.op().toUpperCase(), r -> r));
    }

    public static StateUpdateResolverFactory withDefaults() {
        return new StateUpdateResolverFactory(List.of(
                new SetStateUpdateResolver(),
                new AddStateUpdateResolver(),
                new SubStateUpdateResolver()));
    }

    public StateUpdateResolver get(String op) {
        if (op == null) {
            return null;
        }
        return resolvers.get(op.toUpperCase());
    }

    public StateUpdateResolver require(String op) {
        StateUpdateResolver resolver = get(op);
        if (resolver == null) {
            throw new StateFuzzerException(
                    StateFuzzerErrorCode.UPDATE_OPERATION_NOT_FOUND,
                    "No state update resolver registered for op '" + op + "'")
                    .withMetaData(Map.of("op", String.valueOf(op), "registered", resolvers.keySet()));
        }
        return resolver;
    }

    public boolean supports(String op) {
        return get(op) != null;
    }
}
