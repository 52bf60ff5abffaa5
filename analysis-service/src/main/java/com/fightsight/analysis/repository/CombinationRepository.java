package com.fightsight.analysis.repository;

import com.fightsight.analysis.model.Combination;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CombinationRepository extends ReactiveCrudRepository<Combination, Long> {

    Flux<Combination> findBySessionIdOrderByStartTimestampAsc(Long sessionId);

    /**
     * Removes every combination of the session. Membership links go with them
     * (ON DELETE CASCADE) and strike events lose their combination reference (SET NULL).
     */
    @Modifying
    @Query("DELETE FROM combinations WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(Long sessionId);
}
