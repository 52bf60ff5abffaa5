package com.fightsight.analysis.repository;

import com.fightsight.analysis.model.StrikeEvent;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface StrikeEventRepository extends ReactiveCrudRepository<StrikeEvent, Long> {

    Flux<StrikeEvent> findBySessionIdOrderByTimestampSecondsAsc(Long sessionId);

    @Modifying
    @Query("DELETE FROM strike_events WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(Long sessionId);
}
