package com.fightsight.common.exception;

import java.time.Duration;

public class PipelineTimeoutException extends PipelineException {

    private final Duration budget;

    public PipelineTimeoutException(Long sessionId, Duration budget) {
        super(sessionId, "Session exceeded its processing budget of " + budget.toSeconds() + "s");
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
