package com.fightsight.analysis.repository;

import com.fightsight.analysis.model.AnalysisSession;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface AnalysisSessionRepository extends ReactiveCrudRepository<AnalysisSession, Long> {

    /**
     * Atomic PENDING → PROCESSING claim. Returns the number of rows updated: 1 when this
     * worker now owns the session, 0 when another worker got there first.
     */
    @Modifying
    @Query("""
        UPDATE analysis_sessions
        SET status = 'PROCESSING', started_at = :startedAt, error_message = NULL
        WHERE id = :id AND status = 'PENDING'
        """)
    Mono<Integer> claimForProcessing(Long id, LocalDateTime startedAt);
}
