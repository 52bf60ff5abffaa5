package com.fightsight.analysis.config;

import com.fightsight.analysis.pipeline.ProviderRateLimiter;
import com.fightsight.common.detection.DetectorSettings;
import com.fightsight.common.detection.StrikeCandidateDetector;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class AnalysisConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

    /** Pose payloads for a few minutes of 30 fps video run to tens of megabytes. */
    private static final int POSE_PAYLOAD_LIMIT_BYTES = 64 * 1024 * 1024;

    @Value("${services.pose-source.base-url}")
    private String poseSourceUrl;

    @Value("${services.classifier.base-url}")
    private String classifierUrl;

    @Value("${services.classifier.api-key:}")
    private String classifierApiKey;

    @Value("${services.report.base-url}")
    private String reportUrl;

    @Value("${services.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${services.response-timeout-seconds:30}")
    private int responseTimeoutSeconds;

    // ── collaborators ─────────────────────────────────────────────────────────

    @Bean
    public WebClient poseSourceWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(poseSourceUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(POSE_PAYLOAD_LIMIT_BYTES))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient classifierWebClient(WebClient.Builder builder) {
        WebClient.Builder configured = builder
            .baseUrl(classifierUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter());
        if (classifierApiKey == null || classifierApiKey.isBlank()) {
            log.warn("[AnalysisConfig] No classifier API key configured; calls go out unauthenticated.");
        } else {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + classifierApiKey);
        }
        return configured.build();
    }

    @Bean
    public WebClient reportWebClient(WebClient.Builder builder) {
        return builder
            .baseUrl(reportUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient()))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter())
            .build();
    }

    // ── pipeline components ───────────────────────────────────────────────────

    @Bean
    public StrikeCandidateDetector strikeCandidateDetector(
            @Value("${pipeline.detection.velocity-threshold:0.05}") double velocityThreshold,
            @Value("${pipeline.detection.min-visibility:0.5}") double minVisibility,
            @Value("${pipeline.detection.refractory-seconds:0.3}") double refractorySeconds) {
        return new StrikeCandidateDetector(new DetectorSettings(velocityThreshold, minVisibility, refractorySeconds));
    }

    /** One limiter per provider, shared by every session on this worker. */
    @Bean
    public ProviderRateLimiter classifierRateLimiter(
            @Value("${pipeline.classification.permits-per-second:5}") double permitsPerSecond) {
        return new ProviderRateLimiter("classifier", permitsPerSecond);
    }

    @Bean
    public ClassificationSettings classificationSettings(
            @Value("${pipeline.classification.max-concurrency:10}") int maxConcurrency,
            @Value("${pipeline.classification.max-attempts:3}") int maxAttempts,
            @Value("${pipeline.classification.initial-backoff-ms:500}") long initialBackoffMs,
            @Value("${pipeline.classification.max-backoff-ms:8000}") long maxBackoffMs) {
        return new ClassificationSettings(maxConcurrency, maxAttempts,
            Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs));
    }

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${pipeline.combination.window-seconds:2.0}") double combinationWindowSeconds,
            @Value("${pipeline.enrichment.counter-window-seconds:1.0}") double counterWindowSeconds,
            @Value("${pipeline.session.max-duration-seconds:1800}") long maxDurationSeconds,
            @Value("${pipeline.session.drain-grace-seconds:30}") long drainGraceSeconds,
            @Value("${pipeline.worker.max-concurrent-sessions:4}") int maxConcurrentSessions) {
        return new PipelineSettings(combinationWindowSeconds, counterWindowSeconds,
            Duration.ofSeconds(maxDurationSeconds), Duration.ofSeconds(drainGraceSeconds),
            maxConcurrentSessions);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private HttpClient httpClient() {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[AnalysisConfig] Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
