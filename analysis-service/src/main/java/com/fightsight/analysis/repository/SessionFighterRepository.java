package com.fightsight.analysis.repository;

import com.fightsight.analysis.model.SessionFighter;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface SessionFighterRepository extends ReactiveCrudRepository<SessionFighter, Long> {

    Flux<SessionFighter> findBySessionId(Long sessionId);
}
