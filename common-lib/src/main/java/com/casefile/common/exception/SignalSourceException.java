package com.casefile.common.exception;

/**
 * A photo or calendar provider could not deliver its payload (fetch failure, permission
 * denied, bridge not configured). The pipeline records the source as unavailable and
 * continues with the other one.
 */
public class SignalSourceException extends PipelineException {

    public SignalSourceException(String source, String message) {
        super(source, message);
    }

    public SignalSourceException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
