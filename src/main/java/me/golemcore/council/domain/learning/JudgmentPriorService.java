package me.golemcore.council.domain.learning;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.ConstraintFeatures;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.KnowledgeType;
import me.golemcore.council.domain.model.LearnedBucket;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.PriorPrediction;
import me.golemcore.council.domain.model.SituationFeatures;
import me.golemcore.council.domain.model.TrainingSample;
import me.golemcore.council.domain.model.TypeWeights;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Learned prior over knowledge-type weights, keyed by coarse situation bucket.
 *
 * <p>
 * Readers see an immutable bucket map through an {@link AtomicReference}.
 * Training builds a merged copy under a single writer lock, persists it
 * atomically and swaps it in, so scoring never observes a half-trained cache
 * and a failed write leaves both disk and memory on the previous version.
 * Buckets are only ever added or replaced; {@link #reset()} is the one way to
 * drop them.
 */
@Service
@Slf4j
public class JudgmentPriorService {

    static final double UNKNOWN_BUCKET_CONFIDENCE = 0.3;
    static final double MAX_CONFIDENCE = 0.95;
    static final double HIGH_IRREVERSIBILITY = 0.7;

    private static final TypeReference<Map<String, LearnedBucket>> BUCKET_MAP = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final CouncilProperties properties;
    private final ObjectMapper objectMapper;

    private final AtomicReference<Map<String, LearnedBucket>> cache = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public JudgmentPriorService(StoragePort storagePort, CouncilProperties properties, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Bucket key {@code {decisionType}_{risk}_{h|l}} from the decision's
     * reversibility class, risk level and whether irreversibility exceeds
     * 0.7.
     */
    public static String computeSituationHash(DecisionFeatures features) {
        SituationFeatures situation = features != null && features.getSituation() != null
                ? features.getSituation()
                : new SituationFeatures();
        ConstraintFeatures constraints = features != null && features.getConstraints() != null
                ? features.getConstraints()
                : new ConstraintFeatures();

        SituationFeatures.DecisionType type = situation.getDecisionType() != null
                ? situation.getDecisionType()
                : SituationFeatures.DecisionType.EXPLORATORY;
        Level risk = situation.getRiskLevel() != null ? situation.getRiskLevel() : Level.LOW;
        String irreversibility = constraints.getIrreversibilityScore() > HIGH_IRREVERSIBILITY ? "h" : "l";

        return type.name().toLowerCase(Locale.ROOT) + "_" + risk.name().toLowerCase(Locale.ROOT) + "_"
                + irreversibility;
    }

    /**
     * Confidence earned by a bucket with {@code sampleCount} samples:
     * {@code min(0.95, 0.5 + 0.1 * ln(1 + n))}.
     */
    public static double confidenceFor(int sampleCount) {
        return Math.min(MAX_CONFIDENCE, 0.5 + 0.1 * Math.log(1.0 + sampleCount));
    }

    public PriorPrediction predict(DecisionFeatures features) {
        String bucket = computeSituationHash(features);
        if (!properties.getLearning().isEnabled()) {
            return PriorPrediction.builder()
                    .bucket(bucket)
                    .weights(TypeWeights.neutral())
                    .confidence(0.0)
                    .build();
        }

        LearnedBucket learned = buckets().get(bucket);
        if (learned == null) {
            return PriorPrediction.builder()
                    .bucket(bucket)
                    .weights(TypeWeights.neutral())
                    .confidence(UNKNOWN_BUCKET_CONFIDENCE)
                    .build();
        }
        return PriorPrediction.builder()
                .bucket(bucket)
                .weights(learned.getWeights())
                .confidence(confidenceFor(learned.getSampleCount()))
                .sampleCount(learned.getSampleCount())
                .build();
    }

    /**
     * Multiply each type's score by the learned weight of the matching bucket
     * when the bucket's confidence reaches {@code confidenceThreshold};
     * otherwise return the scores unchanged.
     */
    public Map<KnowledgeType, Double> applyBias(Map<KnowledgeType, Double> scores, DecisionFeatures features,
            double confidenceThreshold) {
        Map<KnowledgeType, Double> adjusted = new EnumMap<>(KnowledgeType.class);
        adjusted.putAll(scores);
        PriorPrediction prediction = predict(features);
        if (prediction.getConfidence() < confidenceThreshold) {
            return adjusted;
        }
        adjusted.replaceAll((type, score) -> score * prediction.getWeights().get(type));
        return adjusted;
    }

    /**
     * Average the samples per bucket and merge the result into the cache.
     *
     * @return true if the cache was updated and persisted
     */
    public boolean train(List<TrainingSample> samples, boolean force) {
        int minSamples = properties.getLearning().getMinSamples();
        if (samples == null || samples.isEmpty() || (!force && samples.size() < minSamples)) {
            log.info("[Learning] Not enough samples to train: {} (min {})",
                    samples == null ? 0 : samples.size(), minSamples);
            return false;
        }

        Map<String, List<TypeWeights>> grouped = new LinkedHashMap<>();
        for (TrainingSample sample : samples) {
            if (sample.getLabel() == null) {
                continue;
            }
            grouped.computeIfAbsent(computeSituationHash(sample.getFeatures()), key -> new ArrayList<>())
                    .add(sample.getLabel());
        }

        writeLock.lock();
        try {
            Map<String, LearnedBucket> next = new LinkedHashMap<>(buckets());
            grouped.forEach((bucket, labels) -> next.put(bucket, LearnedBucket.builder()
                    .weights(TypeWeights.average(labels))
                    .sampleCount(labels.size())
                    .build()));

            if (!persist(next)) {
                return false;
            }
            cache.set(Collections.unmodifiableMap(next));
            log.info("[Learning] Trained prior on {} samples across {} buckets", samples.size(), grouped.size());
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Drop every learned bucket, on disk and in memory.
     */
    public boolean reset() {
        writeLock.lock();
        try {
            storagePort.deleteObject(directory(), properties.getLearning().getPriorFile()).join();
            cache.set(Map.of());
            log.info("[Learning] Learned prior reset");
            return true;
        } catch (RuntimeException e) {
            log.warn("[Learning] Failed to reset learned prior: {}", e.getMessage());
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    public Map<String, LearnedBucket> buckets() {
        Map<String, LearnedBucket> current = cache.get();
        if (current == null) {
            writeLock.lock();
            try {
                current = cache.get();
                if (current == null) {
                    current = load();
                    cache.set(current);
                }
            } finally {
                writeLock.unlock();
            }
        }
        return current;
    }

    private Map<String, LearnedBucket> load() {
        try {
            String json = storagePort.getText(directory(), properties.getLearning().getPriorFile()).join();
            if (json == null || json.isBlank()) {
                return Map.of();
            }
            Map<String, LearnedBucket> loaded = objectMapper.readValue(json, BUCKET_MAP);
            log.info("[Learning] Loaded learned prior with {} buckets", loaded.size());
            return Collections.unmodifiableMap(new LinkedHashMap<>(loaded));
        } catch (IOException | RuntimeException e) {
            log.warn("[Learning] Failed to load learned prior, starting empty: {}", e.getMessage());
            return Map.of();
        }
    }

    private boolean persist(Map<String, LearnedBucket> buckets) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(buckets);
            storagePort.putTextAtomic(directory(), properties.getLearning().getPriorFile(), json, true).join();
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Learning] Failed to persist learned prior, keeping previous cache: {}", e.getMessage());
            return false;
        }
    }

    private String directory() {
        return properties.getLearning().getDirectory();
    }
}
