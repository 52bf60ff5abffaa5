package com.fightsight.analysis.pipeline;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions currently owned by a pipeline on this worker. A session has at most one
 * owner; only the owner mutates its status and progress.
 *
 * <p>This guards a single JVM. Across workers the owner is whoever wins
 * {@code AnalysisSessionRepository#claimForProcessing} in {@link SessionProgressRecorder#start}.
 */
@Component
public class SessionOwnershipRegistry {

    private final Set<Long> owned = ConcurrentHashMap.newKeySet();

    /** @return {@code true} when the caller now owns the session */
    public boolean claim(Long sessionId) {
        return owned.add(sessionId);
    }

    public void release(Long sessionId) {
        owned.remove(sessionId);
    }

    public boolean isOwned(Long sessionId) {
        return owned.contains(sessionId);
    }

    public int activeCount() {
        return owned.size();
    }
}
