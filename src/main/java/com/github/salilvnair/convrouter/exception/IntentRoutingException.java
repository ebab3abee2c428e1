package com.github.salilvnair.convrouter.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class IntentRoutingException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public IntentRoutingException(IntentRoutingErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public IntentRoutingException(IntentRoutingErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public IntentRoutingException(IntentRoutingErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public IntentRoutingException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

    public boolean is(IntentRoutingErrorCode code) {
        return code != null && code.name().equals(errorCode);
    }
}
