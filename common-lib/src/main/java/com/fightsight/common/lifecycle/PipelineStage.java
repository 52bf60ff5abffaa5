package com.fightsight.common.lifecycle;

/**
 * Fixed-weight pipeline stages, in execution order. Weights sum to 100.
 */
public enum PipelineStage {
    DETECTION(20),
    CLASSIFICATION(60),
    ENRICHMENT(20);

    private final int weight;

    PipelineStage(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /** Progress percentage reached once this stage and all earlier ones are done. */
    public int cumulativePercentage() {
        int total = 0;
        for (PipelineStage stage : values()) {
            total += stage.weight;
            if (stage == this) {
                break;
            }
        }
        return total;
    }
}
