package com.fightsight.analysis.pipeline;

import java.util.List;

/**
 * @param outcomes one per candidate, ordered by (timestamp, frame, thrower, limb)
 */
public record ClassificationReport(List<ClassificationOutcome> outcomes, ClassificationTally tally) {

    public ClassificationReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<ClassificationOutcome> confirmed() {
        return outcomes.stream().filter(ClassificationOutcome::isConfirmed).toList();
    }
}
