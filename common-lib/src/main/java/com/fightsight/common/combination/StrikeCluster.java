package com.fightsight.common.combination;

import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.StrikeRecord;

import java.util.List;

/**
 * A run of two or more strikes from one thrower. Members are in canonical order;
 * a member's position in the combination is its list index + 1.
 */
public record StrikeCluster(
    FighterLabel thrower,
    List<StrikeRecord> members
) {
    public StrikeCluster {
        members = List.copyOf(members);
    }

    public int strikeCount() {
        return members.size();
    }

    public double startTimestamp() {
        return members.get(0).timestampSeconds();
    }

    public double endTimestamp() {
        return members.get(members.size() - 1).timestampSeconds();
    }

    public double durationSeconds() {
        return endTimestamp() - startTimestamp();
    }

    public int landedCount() {
        return (int) members.stream().filter(StrikeRecord::landed).count();
    }

    public int missedCount() {
        return strikeCount() - landedCount();
    }
}
