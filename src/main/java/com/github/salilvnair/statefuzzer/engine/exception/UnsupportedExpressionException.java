package com.github.salilvnair.statefuzzer.engine.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when an expression falls outside the restricted grammar. Never recoverable:
 * a malformed precondition, update condition or invariant aborts the whole run.
 */
@Getter
public class UnsupportedExpressionException extends StateFuzzerException {

    private final String expression;
    private final int position;

    public UnsupportedExpressionException(String expression, int position, String reason) {
        super(StateFuzzerErrorCode.UNSUPPORTED_EXPRESSION,
                StateFuzzerErrorCode.UNSUPPORTED_EXPRESSION.defaultMessage()
                        + ": " + reason + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("expression", expression);
        meta.put("position", position);
        withMetaData(meta);
    }
}
