package com.fightsight.analysis.job;

import com.fightsight.analysis.config.PipelineSettings;
import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.analysis.pipeline.AnalysisPipeline;
import com.fightsight.analysis.pipeline.SessionOwnershipRegistry;
import com.fightsight.common.model.AnalysisStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class AnalysisJobDispatcherTest {

    private AnalysisPipeline pipeline;
    private SessionOwnershipRegistry ownership;
    private AnalysisJobDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        pipeline = mock(AnalysisPipeline.class);
        ownership = new SessionOwnershipRegistry();
        dispatcher = new AnalysisJobDispatcher(pipeline, ownership,
            new PipelineSettings(2.0, 1.0, Duration.ofMinutes(5), Duration.ofSeconds(5), 2));
        dispatcher.start();
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    @Test
    @DisplayName("queued jobs are handed to the pipeline")
    void submit_runsPipeline() {
        when(pipeline.run(anyLong(), any())).thenAnswer(inv -> Mono.just(completed(inv.getArgument(0))));

        assertTrue(dispatcher.submit(new AnalysisJob(1L, null)));
        assertTrue(dispatcher.submit(new AnalysisJob(2L, "s3://frames/two")));

        verify(pipeline, timeout(1000)).run(1L, null);
        verify(pipeline, timeout(1000)).run(2L, "s3://frames/two");
    }

    @Test
    @DisplayName("a rejected run does not stop the queue")
    void failingRun_queueKeepsDraining() {
        when(pipeline.run(eq(1L), any())).thenReturn(Mono.error(new IllegalStateException("already running")));
        when(pipeline.run(eq(2L), any())).thenReturn(Mono.just(completed(2L)));

        dispatcher.submit(new AnalysisJob(1L, null));
        dispatcher.submit(new AnalysisJob(2L, null));

        verify(pipeline, timeout(1000)).run(2L, null);
    }

    @Test
    @DisplayName("nothing is accepted after shutdown")
    void stopped_rejects() {
        dispatcher.stop();

        assertFalse(dispatcher.submit(new AnalysisJob(3L, null)));
    }

    @Test
    @DisplayName("isRunning() reflects session ownership")
    void isRunning() {
        ownership.claim(9L);

        assertTrue(dispatcher.isRunning(9L));
        assertFalse(dispatcher.isRunning(10L));
    }

    private static AnalysisSession completed(Long id) {
        AnalysisSession session = new AnalysisSession();
        session.setId(id);
        session.setStatus(AnalysisStatus.COMPLETED);
        return session;
    }
}
