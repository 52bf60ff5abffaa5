package com.fightsight.analysis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Ordered membership link. Positions inside a combination run 1..N without gaps and
 * a strike event appears in at most one link.
 */
@Data
@NoArgsConstructor
@Table("combination_strikes")
public class CombinationStrike {

    @Id
    private Long id;

    private Long combinationId;

    private Long strikeEventId;

    private Integer positionInSequence;
}
