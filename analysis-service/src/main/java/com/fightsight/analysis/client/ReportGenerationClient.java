package com.fightsight.analysis.client;

import com.fightsight.analysis.client.dto.GeneratedReport;
import com.fightsight.analysis.client.dto.ReportRequest;
import com.fightsight.common.exception.FatalProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@code POST /v1/reports} against the report generator.
 */
@Component
public class ReportGenerationClient implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerationClient.class);

    private static final String PROVIDER = "report-generator";

    private final WebClient webClient;

    public ReportGenerationClient(@Qualifier("reportWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<GeneratedReport> generate(ReportRequest request) {
        Long sessionId = request.sessionId();
        return webClient.post()
            .uri("/v1/reports")
            .bodyValue(request)
            .retrieve()
            .bodyToMono(GeneratedReport.class)
            .switchIfEmpty(Mono.error(() -> new FatalProviderException(sessionId, "Report generator returned an empty body")))
            .onErrorMap(e -> ProviderErrors.translate(sessionId, PROVIDER, e))
            .doOnSuccess(r -> log.info("[ReportGenerator] Report generated. sessionId={} cost={}",
                                       sessionId, r.cost()));
    }
}
