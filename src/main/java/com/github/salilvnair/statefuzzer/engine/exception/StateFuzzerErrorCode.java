package com.github.salilvnair.statefuzzer.engine.exception;

public enum StateFuzzerErrorCode {

    // =========================
    // Model source errors
    // =========================
    MODEL_NOT_FOUND(
            "State model source not found",
            true
    ),

    MODEL_UNPARSEABLE(
            "State model source could not be parsed",
            false
    ),

    // =========================
    // Expression errors
    // =========================
    UNSUPPORTED_EXPRESSION(
            "Unsupported expression for invariant evaluation",
            false
    ),

    EXPRESSION_TYPE_MISMATCH(
            "Expression operands have incompatible types",
            false
    ),

    UNKNOWN_IDENTIFIER(
            "Expression references an identifier missing from scope",
            false
    ),

    // =========================
    // Update errors
    // =========================
    UPDATE_OPERATION_NOT_FOUND(
            "No state update resolver registered for operation",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    StateFuzzerErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
