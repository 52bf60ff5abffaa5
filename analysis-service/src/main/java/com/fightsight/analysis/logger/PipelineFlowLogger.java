package com.fightsight.analysis.logger;

import com.fightsight.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a session run inside the reactive pipeline. Pure side effect.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_ACCEPTED}          — the pipeline claimed the session</li>
 *   <li>{@link #FRAMES_FETCHED}        — pose source returned the frames</li>
 *   <li>{@link #CANDIDATES_DETECTED}   — detector finished</li>
 *   <li>{@link #STRIKES_CLASSIFIED}    — classification fan-out finished and strikes are stored</li>
 *   <li>{@link #COMBINATIONS_BUILT}    — combinations and links are stored</li>
 *   <li>{@link #STRIKES_ENRICHED}      — enrichment fields and fighter totals are stored</li>
 *   <li>{@link #SESSION_COMPLETED}     — status is COMPLETED</li>
 *   <li>{@link #REPORT_STORED}         — report generator output is stored</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach}; the session id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineFlowLogger.FRAMES_FETCHED))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_ACCEPTED        = "RUN_ACCEPTED";
    public static final String FRAMES_FETCHED      = "FRAMES_FETCHED";
    public static final String CANDIDATES_DETECTED = "CANDIDATES_DETECTED";
    public static final String STRIKES_CLASSIFIED  = "STRIKES_CLASSIFIED";
    public static final String COMBINATIONS_BUILT  = "COMBINATIONS_BUILT";
    public static final String STRIKES_ENRICHED    = "STRIKES_ENRICHED";
    public static final String SESSION_COMPLETED   = "SESSION_COMPLETED";
    public static final String REPORT_STORED       = "REPORT_STORED";

    /**
     * {@code doOnEach} consumer logging {@code stageName} on {@code onNext} only.
     * The session id is bridged Context → MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            TraceContextUtil.withMdc(sessionId, () ->
                log.info("[PipelineFlow] stage={} sessionId={}", stageName, sessionId)
            );
        };
    }
}
