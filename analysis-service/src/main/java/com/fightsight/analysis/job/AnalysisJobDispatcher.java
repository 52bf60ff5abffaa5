package com.fightsight.analysis.job;

import com.fightsight.analysis.config.PipelineSettings;
import com.fightsight.analysis.pipeline.AnalysisPipeline;
import com.fightsight.analysis.pipeline.SessionOwnershipRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Background worker queue. Accepted jobs are drained by at most
 * {@code pipeline.worker.max-concurrent-sessions} pipelines at once; each session is
 * processed by a single pipeline from start to terminal status.
 *
 * <p>A failing run is logged and absorbed so the queue keeps draining.
 */
@Component
public class AnalysisJobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AnalysisJobDispatcher.class);

    private final Sinks.Many<AnalysisJob> queue = Sinks.many().unicast().onBackpressureBuffer();

    private final AnalysisPipeline pipeline;
    private final SessionOwnershipRegistry ownership;
    private final PipelineSettings settings;

    private Disposable subscription;

    public AnalysisJobDispatcher(AnalysisPipeline pipeline,
                                 SessionOwnershipRegistry ownership,
                                 PipelineSettings settings) {
        this.pipeline  = pipeline;
        this.ownership = ownership;
        this.settings  = settings;
    }

    @PostConstruct
    public void start() {
        log.info("[Dispatcher] Worker started. maxConcurrentSessions={}", settings.maxConcurrentSessions());
        subscription = queue.asFlux()
            .flatMap(this::execute, settings.maxConcurrentSessions())
            .subscribe();
    }

    /**
     * Queues a run. Returns {@code false} when the queue refuses the job, for example
     * after shutdown.
     */
    public synchronized boolean submit(AnalysisJob job) {
        Sinks.EmitResult result = queue.tryEmitNext(job);
        if (result.isFailure()) {
            log.warn("[Dispatcher] Job rejected. sessionId={} result={}", job.sessionId(), result);
            return false;
        }
        log.info("[Dispatcher] Job queued. sessionId={} activeSessions={}", job.sessionId(), ownership.activeCount());
        return true;
    }

    /** Whether a pipeline on this worker currently owns the session. */
    public boolean isRunning(Long sessionId) {
        return ownership.isOwned(sessionId);
    }

    private Mono<Void> execute(AnalysisJob job) {
        return pipeline.run(job.sessionId(), job.framesLocation())
            .doOnNext(session -> log.info("[Dispatcher] Run finished. sessionId={} status={} activeSessions={}",
                                          session.getId(), session.getStatus(), ownership.activeCount()))
            .onErrorResume(e -> {
                log.error("[Dispatcher] Run rejected. sessionId={} errorType={} reason={}",
                          job.sessionId(), e.getClass().getSimpleName(), e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    @PreDestroy
    public void stop() {
        queue.tryEmitComplete();
        if (subscription != null) {
            subscription.dispose();
        }
        log.info("[Dispatcher] Worker stopped");
    }
}
