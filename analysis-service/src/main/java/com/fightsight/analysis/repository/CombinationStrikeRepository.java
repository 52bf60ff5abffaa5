package com.fightsight.analysis.repository;

import com.fightsight.analysis.model.CombinationStrike;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface CombinationStrikeRepository extends ReactiveCrudRepository<CombinationStrike, Long> {

    @Query("""
        SELECT cs.* FROM combination_strikes cs
        INNER JOIN combinations c ON c.id = cs.combination_id
        WHERE c.session_id = :sessionId
        ORDER BY cs.combination_id, cs.position_in_sequence
        """)
    Flux<CombinationStrike> findBySessionId(Long sessionId);
}
