package com.fightsight.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the analysis session id through reactive pipelines.
 *
 * <p>Reactor Context is the single source of truth for the session id inside a pipeline.
 * MDC is only written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store: classification calls hop threads freely.
 *
 * <p>Usage pattern:
 * <pre>
 *     return TraceContextUtil.withSessionId(pipeline, session.getId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String SESSION_ID_KEY = "sessionId";

    private TraceContextUtil() {}

    /**
     * Stores {@code sessionId} in the Reactor Context. {@code contextWrite} propagates
     * upstream during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withSessionId(Mono<T> mono, Long sessionId) {
        return mono.contextWrite(ctx -> ctx.put(SESSION_ID_KEY, String.valueOf(sessionId)));
    }

    /**
     * Returns the session id from the context, or {@code "unknown"}; never {@code null}.
     */
    public static String getSessionId(ContextView ctx) {
        return ctx.getOrDefault(SESSION_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code sessionId} into MDC for the duration of {@code logAction} only.
     */
    public static void withMdc(String sessionId, Runnable logAction) {
        MDC.put(SESSION_ID_KEY, sessionId);
        try {
            logAction.run();
        } finally {
            MDC.remove(SESSION_ID_KEY);
        }
    }
}
