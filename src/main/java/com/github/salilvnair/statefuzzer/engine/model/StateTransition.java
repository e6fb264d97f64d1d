package com.github.salilvnair.statefuzzer.engine.model;

/**
 * Output of one action application: the new state and an optional summary of the
 * variables it touched.
 */
public record StateTransition(ContractState state, String note) {
}
