package com.fightsight.common.exception;

import com.fightsight.common.model.AnalysisStatus;

public class IllegalSessionTransitionException extends PipelineException {

    private final AnalysisStatus from;
    private final AnalysisStatus to;

    public IllegalSessionTransitionException(Long sessionId, AnalysisStatus from, AnalysisStatus to) {
        super(sessionId, "Illegal status transition " + from + " -> " + to);
        this.from = from;
        this.to   = to;
    }

    public AnalysisStatus getFrom() { return from; }
    public AnalysisStatus getTo()   { return to; }

    @Override
    public boolean isFatal() {
        return true;
    }
}
