package com.fightsight.analysis.client;

import com.fightsight.analysis.client.dto.ClassificationRequest;
import com.fightsight.analysis.client.dto.ClassificationResponse;
import com.fightsight.common.exception.FatalProviderException;
import com.fightsight.common.model.Stance;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.StrikeOutcome;
import com.fightsight.common.model.TargetZone;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * {@code POST /v1/classify} against the classification provider.
 *
 * <p>The body is read as text and validated field by field; anything that does not
 * match the contract is a malformed response and therefore fatal:
 * <pre>
 *   {"strike_detected": false, "cost": 0.002}
 *   {"strike_detected": true, "stance": "orthodox", "category": "hand", "technique": "jab",
 *    "modifier": null, "target_zone": "head", "outcome": "landed_clean",
 *    "confidence": 0.91, "reasoning": "...", "cost": 0.004}
 * </pre>
 */
@Component
public class StrikeClassifierClient implements StrikeClassifier {

    private static final Logger log = LoggerFactory.getLogger(StrikeClassifierClient.class);

    private static final String PROVIDER = "classifier";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public StrikeClassifierClient(@Qualifier("classifierWebClient") WebClient webClient,
                                  ObjectMapper objectMapper) {
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ClassificationResponse> classify(ClassificationRequest request) {
        Long sessionId = request.sessionId();
        return webClient.post()
            .uri("/v1/classify")
            .bodyValue(request)
            .retrieve()
            .bodyToMono(String.class)
            .switchIfEmpty(Mono.error(() -> new FatalProviderException(sessionId, "Classifier returned an empty body")))
            .map(body -> parse(sessionId, body))
            .onErrorMap(e -> ProviderErrors.translate(sessionId, PROVIDER, e))
            .doOnError(e -> log.debug("[Classifier] Call failed. sessionId={} frame={} reason={}",
                                      sessionId, request.frameIndices().during(), e.getMessage()));
    }

    ClassificationResponse parse(Long sessionId, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new FatalProviderException(sessionId, "Classifier returned unparseable JSON", e);
        }
        if (root == null || !root.path("strike_detected").isBoolean()) {
            throw new FatalProviderException(sessionId, "Classifier response lacks boolean strike_detected");
        }

        double cost = root.path("cost").asDouble(0.0);
        if (!Double.isFinite(cost) || cost < 0.0) {
            throw new FatalProviderException(sessionId, "Classifier reported an invalid cost: " + cost);
        }
        if (!root.path("strike_detected").asBoolean()) {
            return ClassificationResponse.falsePositive(cost);
        }

        JsonNode confidenceNode = root.path("confidence");
        if (!confidenceNode.isNumber()) {
            throw new FatalProviderException(sessionId, "Classifier response lacks numeric confidence");
        }
        double confidence = confidenceNode.asDouble();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new FatalProviderException(sessionId, "Classifier confidence out of range: " + confidence);
        }

        return new ClassificationResponse(
            true,
            optionalEnum(sessionId, root, "stance", Stance::fromWire),
            requiredEnum(sessionId, root, "category", StrikeCategory::fromWire),
            textOrNull(root, "technique"),
            textOrNull(root, "modifier"),
            requiredEnum(sessionId, root, "target_zone", TargetZone::fromWire),
            requiredEnum(sessionId, root, "outcome", StrikeOutcome::fromWire),
            confidence,
            textOrNull(root, "reasoning"),
            cost);
    }

    private static <E> E requiredEnum(Long sessionId, JsonNode root, String field, Function<String, E> parser) {
        E value = optionalEnum(sessionId, root, field, parser);
        if (value == null) {
            throw new FatalProviderException(sessionId, "Classifier response lacks " + field);
        }
        return value;
    }

    private static <E> E optionalEnum(Long sessionId, JsonNode root, String field, Function<String, E> parser) {
        String raw = textOrNull(root, field);
        if (raw == null) {
            return null;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new FatalProviderException(sessionId, "Classifier returned unknown " + field + ": " + raw, e);
        }
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
