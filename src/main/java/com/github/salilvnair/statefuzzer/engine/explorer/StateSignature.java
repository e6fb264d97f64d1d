package com.github.salilvnair.statefuzzer.engine.explorer;

import com.github.salilvnair.statefuzzer.engine.constants.StateFuzzerPayloadKey;
import com.github.salilvnair.statefuzzer.engine.model.ContractState;
import com.github.salilvnair.statefuzzer.util.JsonUtil;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical hash of a state's storage and balances. Metadata is not part of it.
 */
public final class StateSignature {

    private static final String ALGORITHM = "SHA-1";

    private StateSignature() {}

    public static String of(ContractState state) {
        Map<String, Object> evaluated = new LinkedHashMap<>();
        evaluated.put(StateFuzzerPayloadKey.STORAGE, state.getStorage());
        evaluated.put(StateFuzzerPayloadKey.BALANCES, state.getBalances());
        byte[] canonical = JsonUtil.toCanonicalJson(evaluated).getBytes(StandardCharsets.UTF_8);
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(ALGORITHM).digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " digest unavailable", e);
        }
    }
}
