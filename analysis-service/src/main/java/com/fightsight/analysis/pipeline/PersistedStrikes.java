package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.model.StrikeEvent;
import com.fightsight.common.exception.IntegrityViolationException;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.StrikeRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A session's stored strike events next to the {@link StrikeRecord} view the pure
 * clustering and enrichment code works on.
 */
public final class PersistedStrikes {

    private final List<StrikeEvent> events;
    private final List<StrikeRecord> records;
    private final Map<StrikeRecord, StrikeEvent> eventsByRecord;

    private PersistedStrikes(List<StrikeEvent> events, List<StrikeRecord> records,
                             Map<StrikeRecord, StrikeEvent> eventsByRecord) {
        this.events         = events;
        this.records        = records;
        this.eventsByRecord = eventsByRecord;
    }

    public static PersistedStrikes of(Long sessionId, List<StrikeEvent> events, SessionFighters fighters) {
        List<StrikeRecord> records = new ArrayList<>(events.size());
        Map<StrikeRecord, StrikeEvent> byRecord = new HashMap<>();
        for (StrikeEvent event : events) {
            FighterLabel thrower = fighters.labelOf(sessionId, event.getThrowerId());
            FighterLabel receiver = event.getReceiverId() == null
                ? null : fighters.labelOf(sessionId, event.getReceiverId());
            if (receiver != thrower.opponent()) {
                throw new IntegrityViolationException(sessionId,
                    "Strike " + event.getId() + " must be received by the thrower's opponent, thrower="
                    + thrower + " receiver=" + receiver);
            }
            StrikeRecord record = new StrikeRecord(
                event.getId(),
                thrower,
                event.getTimestampSeconds(),
                event.getFrameNumber(),
                event.getLimb(),
                event.getCategory(),
                event.getTargetZone(),
                event.getOutcome(),
                event.getFighterDistance());
            records.add(record);
            byRecord.put(record, event);
        }
        return new PersistedStrikes(List.copyOf(events), List.copyOf(records), byRecord);
    }

    public List<StrikeRecord> records() {
        return records;
    }

    public StrikeEvent eventOf(StrikeRecord record) {
        return eventsByRecord.get(record);
    }

    public int size() {
        return events.size();
    }
}
