package com.casefile.common.exception;

/**
 * The validator could not assemble the required number of grounded deductions from the
 * draft and the available insight candidates.
 */
public class UngroundedNarrationException extends PipelineException {
    private final int groundedCount;

    public UngroundedNarrationException(int groundedCount, int required) {
        super("validation", "only " + groundedCount + " grounded deductions, " + required + " required");
        this.groundedCount = groundedCount;
    }

    public int getGroundedCount() {
        return groundedCount;
    }
}
