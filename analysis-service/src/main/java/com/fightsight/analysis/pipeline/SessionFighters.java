package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.model.SessionFighter;
import com.fightsight.common.exception.IntegrityViolationException;
import com.fightsight.common.model.FighterLabel;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The two fighters of a session, addressable by label and by row id.
 */
public final class SessionFighters {

    private final Map<FighterLabel, SessionFighter> byLabel;
    private final Map<Long, FighterLabel> labelsById;

    private SessionFighters(Map<FighterLabel, SessionFighter> byLabel) {
        this.byLabel    = byLabel;
        this.labelsById = new HashMap<>();
        byLabel.forEach((label, fighter) -> labelsById.put(fighter.getId(), label));
    }

    /**
     * @throws IntegrityViolationException unless there is exactly one fighter per label
     */
    public static SessionFighters of(Long sessionId, List<SessionFighter> fighters) {
        Map<FighterLabel, SessionFighter> byLabel = new EnumMap<>(FighterLabel.class);
        for (SessionFighter fighter : fighters) {
            if (fighter.getLabel() == null || byLabel.put(fighter.getLabel(), fighter) != null) {
                throw new IntegrityViolationException(sessionId,
                    "Fighter labels must be unique and present, got " + fighter.getLabel());
            }
        }
        if (byLabel.size() != FighterLabel.values().length) {
            throw new IntegrityViolationException(sessionId,
                "Session needs exactly two fighters, found " + byLabel.keySet());
        }
        return new SessionFighters(byLabel);
    }

    public Long idOf(FighterLabel label) {
        return byLabel.get(label).getId();
    }

    /**
     * @throws IntegrityViolationException when {@code fighterId} is not one of the session's fighters
     */
    public FighterLabel labelOf(Long sessionId, Long fighterId) {
        FighterLabel label = labelsById.get(fighterId);
        if (label == null) {
            throw new IntegrityViolationException(sessionId, "Fighter " + fighterId + " does not belong to the session");
        }
        return label;
    }

    public Collection<SessionFighter> all() {
        return byLabel.values();
    }
}
