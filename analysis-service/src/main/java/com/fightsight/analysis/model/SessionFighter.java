package com.fightsight.analysis.model;

import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.Stance;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One of the two participants of a session. Aggregate counts are written once,
 * after enrichment.
 */
@Data
@NoArgsConstructor
@Table("session_fighters")
public class SessionFighter {

    @Id
    private Long id;

    private Long sessionId;

    /** External fighter profile; nulled when the profile is deleted. */
    private String fighterProfileId;

    private FighterLabel label;

    private String displayName;

    private Stance stance;

    private Integer strikesThrown;

    private Integer strikesLanded;

    private Integer strikesReceived;

    private Integer combinationsThrown;
}
