package com.github.salilvnair.statefuzzer.engine.constants;

public final class StateFuzzerConstants {

    private StateFuzzerConstants() {
    }

    public static final String TOOL_NAME = "state-fuzzer";
    public static final String CATEGORY_STATE_INVARIANT = "state-invariant";
    public static final String TITLE_PREFIX = "Invariant violated: ";

    public static final String DEFAULT_ACTION_NAME = "action";
    public static final String DEFAULT_INVARIANT_NAME = "invariant";
    public static final String DEFAULT_SEVERITY = "HIGH";
    public static final String DEFAULT_UPDATE_OP = "set";

    public static final String NOTE_SEPARATOR = ", ";
    public static final String NOTE_ASSIGNMENT = "=";

    public static final int DEFAULT_MAX_DEPTH = 4;
    public static final int DEFAULT_MAX_BRANCHES_PER_STATE = 6;
}
