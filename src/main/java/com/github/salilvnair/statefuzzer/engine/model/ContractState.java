package com.github.salilvnair.statefuzzer.engine.model;

import com.github.salilvnair.statefuzzer.engine.expression.helper.ValueOperations;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simulated contract state: {@code storage} and {@code balances} are evaluated,
 * {@code metadata} only records provenance.
 * <p>
 * A state is owned by the exploration frame that produced it. Transitions work on a
 * {@link #copy()} and never touch the state they started from.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ContractState {

    private final Map<String, Object> storage;
    private final Map<String, Object> balances;
    private final Map<String, Object> metadata;

    public ContractState() {
        this(Map.of(), Map.of(), Map.of());
    }

    public ContractState(Map<String, ?> storage) {
        this(storage, Map.of(), Map.of());
    }

    public ContractState(Map<String, ?> storage, Map<String, ?> balances, Map<String, ?> metadata) {
        this.storage = ValueOperations.normalizeAll(storage);
        this.balances = ValueOperations.normalizeAll(balances);
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    public ContractState copy() {
        return new ContractState(storage, balances, metadata);
    }

    public Object storageValue(String key) {
        return storage.get(key);
    }

    public void putStorage(String key, Object value) {
        storage.put(key, ValueOperations.normalize(value));
    }

    /** Scope for preconditions and invariants; balances shadow storage on key collision. */
    public Map<String, Object> evaluationScope() {
        Map<String, Object> scope = new LinkedHashMap<>(storage);
        scope.putAll(balances);
        return scope;
    }

    /** Scope for update guards; parameters shadow storage on key collision. */
    public Map<String, Object> guardScope(Map<String, Object> parameters) {
        Map<String, Object> scope = new LinkedHashMap<>(storage);
        if (parameters != null) {
            scope.putAll(parameters);
        }
        return scope;
    }

    public Map<String, Object> storageSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(storage));
    }
}
