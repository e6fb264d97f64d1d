package com.github.salilvnair.statefuzzer.engine.explorer;

import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class StateSignatureTest {

    @Test
    void ignoresMetadata() {
        ContractState a = new ContractState(Map.of("balance", 1), Map.of(), Map.of("source", "a.json"));
        ContractState b = new ContractState(Map.of("balance", 1), Map.of(), Map.of("source", "b.json"));

        assertEquals(StateSignature.of(a), StateSignature.of(b));
    }

    @Test
    void ignoresKeyInsertionOrderAndIntegerWidth() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("balance", 1);
        first.put("gate", true);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("gate", true);
        second.put("balance", 1L);

        assertEquals(StateSignature.of(new ContractState(first)), StateSignature.of(new ContractState(second)));
    }

    @Test
    void distinguishesStorageFromBalances() {
        ContractState inStorage = new ContractState(Map.of("reserve", 50), Map.of(), Map.of());
        ContractState inBalances = new ContractState(Map.of(), Map.of("reserve", 50), Map.of());

        assertNotEquals(StateSignature.of(inStorage), StateSignature.of(inBalances));
    }

    @Test
    void isFortyHexCharacters() {
        assertEquals(40, StateSignature.of(new ContractState()).length());
    }
}
