package com.github.salilvnair.statefuzzer.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class StateFuzzerException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public StateFuzzerException(StateFuzzerErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public StateFuzzerException(StateFuzzerErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public StateFuzzerException(StateFuzzerErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public StateFuzzerException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
