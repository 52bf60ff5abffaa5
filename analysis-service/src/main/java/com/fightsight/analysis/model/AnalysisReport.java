package com.fightsight.analysis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Narrative report produced by the external report generator for a completed session.
 *
 * keyInsights, strengths, areasForImprovement: JSON-serialised {@code List<String>}
 */
@Data
@NoArgsConstructor
@Table("analysis_reports")
public class AnalysisReport {

    @Id
    private Long id;

    private Long sessionId;

    private String narrative;

    private String keyInsights;

    private String strengths;

    private String areasForImprovement;

    private Double generationCost;

    private LocalDateTime createdAt;
}
