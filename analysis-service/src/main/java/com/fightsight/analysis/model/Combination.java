package com.fightsight.analysis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Two or more strikes thrown by one fighter in quick succession.
 * {@code landedCount + missedCount == strikeCount}.
 */
@Data
@NoArgsConstructor
@Table("combinations")
public class Combination {

    @Id
    private Long id;

    private Long sessionId;

    private Long throwerId;

    private Double startTimestamp;

    private Double endTimestamp;

    private Double durationSeconds;

    private Integer strikeCount;

    private Integer landedCount;

    private Integer missedCount;
}
