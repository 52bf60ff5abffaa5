package com.fightsight.analysis.pipeline;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Running classification counters of one session run. Written concurrently by the
 * classifier calls; read by the lifecycle once the stage is over, or on failure to
 * record what was already spent.
 *
 * <p>Once every candidate has an outcome: {@code classified + falsePositive + failed == totalCandidates}.
 */
public class ClassificationTally {

    private final int totalCandidates;
    private final AtomicInteger calls         = new AtomicInteger();
    private final AtomicInteger classified    = new AtomicInteger();
    private final AtomicInteger falsePositive = new AtomicInteger();
    private final AtomicInteger failed        = new AtomicInteger();
    private final DoubleAdder   cost          = new DoubleAdder();

    public ClassificationTally(int totalCandidates) {
        this.totalCandidates = totalCandidates;
    }

    void recordCall() {
        calls.incrementAndGet();
    }

    void recordOutcome(ClassificationOutcome outcome) {
        switch (outcome.status()) {
            case CONFIRMED      -> classified.incrementAndGet();
            case FALSE_POSITIVE -> falsePositive.incrementAndGet();
            case FAILED         -> failed.incrementAndGet();
        }
        if (outcome.response() != null) {
            cost.add(outcome.response().cost());
        }
    }

    public int totalCandidates() { return totalCandidates; }
    public int calls()           { return calls.get(); }
    public int classified()      { return classified.get(); }
    public int falsePositive()   { return falsePositive.get(); }
    public int failed()          { return failed.get(); }
    public double cost()         { return cost.sum(); }

    public boolean isBalanced() {
        return classified() + falsePositive() + failed() == totalCandidates;
    }

    @Override
    public String toString() {
        return "candidates=" + totalCandidates + " calls=" + calls() + " classified=" + classified()
            + " falsePositive=" + falsePositive() + " failed=" + failed() + " cost=" + cost();
    }
}
