package me.golemcore.council.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Multiplicative weight per knowledge type, always within
 * [{@value #MIN_WEIGHT}, {@value #MAX_WEIGHT}].
 *
 * <p>
 * Instances are immutable and the constructor is the only write path, so the
 * band holds for every instance that exists, including those read back from
 * disk.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TypeWeights {

    public static final double MIN_WEIGHT = 0.7;
    public static final double MAX_WEIGHT = 1.3;

    private static final TypeWeights NEUTRAL = new TypeWeights(1.0, 1.0, 1.0, 1.0, 1.0);

    private final double principle;
    private final double rule;
    private final double warning;
    private final double claim;
    private final double advice;

    @JsonCreator
    public TypeWeights(
            @JsonProperty("principle") double principle,
            @JsonProperty("rule") double rule,
            @JsonProperty("warning") double warning,
            @JsonProperty("claim") double claim,
            @JsonProperty("advice") double advice) {
        this.principle = clamp(principle);
        this.rule = clamp(rule);
        this.warning = clamp(warning);
        this.claim = clamp(claim);
        this.advice = clamp(advice);
    }

    public static TypeWeights neutral() {
        return NEUTRAL;
    }

    public static TypeWeights of(Map<KnowledgeType, Double> values) {
        return new TypeWeights(
                values.getOrDefault(KnowledgeType.PRINCIPLE, 1.0),
                values.getOrDefault(KnowledgeType.RULE, 1.0),
                values.getOrDefault(KnowledgeType.WARNING, 1.0),
                values.getOrDefault(KnowledgeType.CLAIM, 1.0),
                values.getOrDefault(KnowledgeType.ADVICE, 1.0));
    }

    /**
     * Field-wise arithmetic mean. An empty collection averages to neutral.
     */
    public static TypeWeights average(Collection<TypeWeights> weights) {
        if (weights == null || weights.isEmpty()) {
            return NEUTRAL;
        }
        Map<KnowledgeType, Double> sums = new EnumMap<>(KnowledgeType.class);
        for (TypeWeights w : weights) {
            for (KnowledgeType type : KnowledgeType.values()) {
                sums.merge(type, w.get(type), Double::sum);
            }
        }
        int n = weights.size();
        Map<KnowledgeType, Double> means = new EnumMap<>(KnowledgeType.class);
        sums.forEach((type, sum) -> means.put(type, sum / n));
        return of(means);
    }

    public double get(KnowledgeType type) {
        return switch (type) {
            case PRINCIPLE -> principle;
            case RULE -> rule;
            case WARNING -> warning;
            case CLAIM -> claim;
            case ADVICE -> advice;
        };
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Type weight must be a number");
        }
        return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, value));
    }
}
