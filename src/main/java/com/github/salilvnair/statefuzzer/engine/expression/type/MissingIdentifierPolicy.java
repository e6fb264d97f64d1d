package com.github.salilvnair.statefuzzer.engine.expression.type;

/**
 * How an identifier that is not present in the evaluation scope is resolved.
 */
public enum MissingIdentifierPolicy {
    /** Resolves to the absent value ({@code null}). */
    ABSENT,
    /** Raises {@code UNKNOWN_IDENTIFIER}. */
    FAIL
}
