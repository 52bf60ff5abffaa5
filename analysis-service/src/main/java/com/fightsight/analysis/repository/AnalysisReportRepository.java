package com.fightsight.analysis.repository;

import com.fightsight.analysis.model.AnalysisReport;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface AnalysisReportRepository extends ReactiveCrudRepository<AnalysisReport, Long> {

    Mono<AnalysisReport> findBySessionId(Long sessionId);

    @Modifying
    @Query("DELETE FROM analysis_reports WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(Long sessionId);
}
