package com.fightsight.analysis.client;

import com.fightsight.analysis.client.dto.GeneratedReport;
import com.fightsight.analysis.client.dto.ReportRequest;
import reactor.core.publisher.Mono;

public interface ReportGenerator {
    Mono<GeneratedReport> generate(ReportRequest request);
}
