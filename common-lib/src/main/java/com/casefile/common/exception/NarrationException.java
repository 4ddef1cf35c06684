package com.casefile.common.exception;

/** The structured generator failed or returned something that is not a JSON object. */
public class NarrationException extends PipelineException {

    public NarrationException(String message) {
        super("narration", message);
    }

    public NarrationException(String message, Throwable cause) {
        super("narration", message, cause);
    }
}
