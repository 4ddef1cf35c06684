package com.casefile.common.exception;

import com.casefile.common.model.PipelineState;

public class PipelineNotReadyException extends PipelineException {

    public PipelineNotReadyException(PipelineState state) {
        super("pipeline", "narrator not ready, state=" + state.wireName() + ". Call prepare first.");
    }
}
