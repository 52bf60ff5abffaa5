package com.fightsight.analysis.client;

import com.fightsight.analysis.client.dto.ClassificationRequest;
import com.fightsight.analysis.client.dto.ClassificationResponse;
import reactor.core.publisher.Mono;

/**
 * Strategy interface for the external strike classifier.
 *
 * <p>Implementations signal failures only as
 * {@link com.fightsight.common.exception.TransientProviderException} (worth retrying) or
 * {@link com.fightsight.common.exception.FatalProviderException} (abort the session).
 */
public interface StrikeClassifier {
    Mono<ClassificationResponse> classify(ClassificationRequest request);
}
