package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.client.ReportGenerator;
import com.fightsight.analysis.client.dto.GeneratedReport;
import com.fightsight.analysis.client.dto.ReportRequest;
import com.fightsight.analysis.model.AnalysisReport;
import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.analysis.model.StrikeEvent;
import com.fightsight.analysis.repository.AnalysisReportRepository;
import com.fightsight.common.combination.StrikeCluster;
import com.fightsight.common.enrichment.StrikeContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Hands a completed session's summary to the report generator and stores the result.
 * Runs after the session is terminal; its failures never touch the session.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final ReportGenerator reportGenerator;
    private final AnalysisReportRepository reportRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReportService(ReportGenerator reportGenerator,
                         AnalysisReportRepository reportRepository,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.reportGenerator  = reportGenerator;
        this.reportRepository = reportRepository;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
    }

    public Mono<AnalysisReport> generate(AnalysisSession session,
                                         PersistedStrikes strikes,
                                         EnrichmentResult enrichment,
                                         CombinationAssignment assignment) {
        ReportRequest request = buildRequest(session, strikes, enrichment, assignment);
        return reportGenerator.generate(request)
            .flatMap(generated -> Mono.fromCallable(() -> toEntity(session.getId(), generated)))
            .flatMap(entity -> reportRepository.deleteBySessionId(session.getId())
                .then(reportRepository.save(entity)))
            .doOnSuccess(r -> log.info("[Report] Stored. sessionId={} reportId={} cost={}",
                                       session.getId(), r.getId(), r.getGenerationCost()));
    }

    static ReportRequest buildRequest(AnalysisSession session,
                                      PersistedStrikes strikes,
                                      EnrichmentResult enrichment,
                                      CombinationAssignment assignment) {
        List<ReportRequest.StrikeLine> strikeLines = enrichment.contexts().stream()
            .map(context -> strikeLine(context, strikes.eventOf(context.strike())))
            .toList();
        List<ReportRequest.CombinationLine> combinationLines = assignment.clusters().stream()
            .map(ReportService::combinationLine)
            .toList();
        return new ReportRequest(session.getId(), session.getSportType(), session.getRoundCount(),
            enrichment.summary(), strikeLines, combinationLines);
    }

    private static ReportRequest.StrikeLine strikeLine(StrikeContext context, StrikeEvent event) {
        return new ReportRequest.StrikeLine(
            context.sequenceNumber(),
            context.strike().timestampSeconds(),
            context.strike().thrower(),
            context.strike().category(),
            event != null ? event.getTechnique() : null,
            context.strike().targetZone(),
            context.strike().outcome(),
            context.rangeBucket(),
            context.initiation(),
            context.positionInCombination());
    }

    private static ReportRequest.CombinationLine combinationLine(StrikeCluster cluster) {
        return new ReportRequest.CombinationLine(cluster.thrower(), cluster.startTimestamp(),
            cluster.strikeCount(), cluster.landedCount());
    }

    private AnalysisReport toEntity(Long sessionId, GeneratedReport generated) throws JsonProcessingException {
        AnalysisReport report = new AnalysisReport();
        report.setSessionId(sessionId);
        report.setNarrative(generated.narrative());
        report.setKeyInsights(objectMapper.writeValueAsString(listOrEmpty(generated.keyInsights())));
        report.setStrengths(objectMapper.writeValueAsString(listOrEmpty(generated.strengths())));
        report.setAreasForImprovement(objectMapper.writeValueAsString(listOrEmpty(generated.areasForImprovement())));
        report.setGenerationCost(generated.cost());
        report.setCreatedAt(LocalDateTime.now(clock));
        return report;
    }

    private static List<String> listOrEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
