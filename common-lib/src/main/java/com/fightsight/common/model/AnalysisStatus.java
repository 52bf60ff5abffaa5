package com.fightsight.common.model;

/**
 * Lifecycle status of an analysis session. {@link #COMPLETED} and {@link #FAILED} are terminal.
 */
public enum AnalysisStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
