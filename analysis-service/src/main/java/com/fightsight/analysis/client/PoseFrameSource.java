package com.fightsight.analysis.client;

import com.fightsight.common.model.PoseFrame;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Strategy interface for the pose source: per-frame landmarks of the two fighters,
 * in frame order.
 */
public interface PoseFrameSource {
    Mono<List<PoseFrame>> fetchFrames(Long sessionId, String framesLocation);
}
