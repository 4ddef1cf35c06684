package com.casefile.common.exception;

public class RunInProgressException extends PipelineException {

    public RunInProgressException(String activeRunId) {
        super("pipeline", "a run is already in progress. runId=" + activeRunId);
    }
}
