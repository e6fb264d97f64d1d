package com.github.salilvnair.statefuzzer.support;

public final class TestConstants {

    private TestConstants() {
    }

    public static final long SEED = 20240611L;
    public static final long OTHER_SEED = 7L;

    public static final String BALANCE = "balance";
    public static final String UNLOCKED = "unlocked";
    public static final String GATE = "gate";
    public static final String AMOUNT = "amount";

    public static final String DEPOSIT = "deposit";
    public static final String BONUS_WITHDRAW = "bonus-withdraw";
    public static final String DRAIN = "drain";
    public static final String CLOSE_GATE = "close-gate";
    public static final String TOGGLE = "toggle";

    public static final String NO_NEGATIVE_BALANCES = "no-negative-balances";
    public static final String BALANCE_NOT_NEGATIVE = "balance-not-negative";

    public static final String MODEL_SCENARIO_B = "/models/scenario-b.json";
    public static final String MODEL_VAULT_SAFE = "/models/vault-safe.json";
    public static final String MODEL_MALFORMED = "/models/malformed.json";
    public static final String MODEL_UNSUPPORTED_INVARIANT = "/models/unsupported-invariant.json";
}
