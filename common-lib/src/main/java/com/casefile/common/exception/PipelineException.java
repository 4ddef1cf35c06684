package com.casefile.common.exception;

public class PipelineException extends RuntimeException {
    private final String stage;

    public PipelineException(String stage, String message) {
        super("[" + stage + "] " + message);
        this.stage = stage;
    }

    public PipelineException(String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
