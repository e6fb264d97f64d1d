package com.github.salilvnair.statefuzzer.engine.constants;

public final class StateFuzzerPayloadKey {

    private StateFuzzerPayloadKey() {
    }

    public static final String TRACE = "trace";
    public static final String ACTION = "action";
    public static final String PARAMETERS = "parameters";
    public static final String NOTE = "note";
    public static final String STATE = "state";
    public static final String SNAPSHOT = "snapshot";

    public static final String STORAGE = "storage";
    public static final String BALANCES = "balances";
    public static final String SOURCE = "source";

    public static final String EXPLORED_TRACES = "explored_traces";
    public static final String UNIQUE_STATES = "unique_states";
    public static final String COVERAGE = "coverage";
    public static final String FINDINGS = "findings";
    public static final String SEED = "seed";
    public static final String MAX_DEPTH = "max_depth";
    public static final String INTERRUPTED = "interrupted";
}
