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

import java.util.EnumMap;
import java.util.Map;

/**
 * Reasoning posture an advisor brings to knowledge scoring. A posture biases
 * the type weight of an entry, e.g. a cautious advisor leans on rules while a
 * creative one leans on advice.
 */
public enum Posture {

    CAUTIOUS(1.2, 1.4, 1.05, 0.95, 0.9),
    BOLD(1.0, 0.7, 0.9, 1.0, 1.3),
    ANALYTICAL(1.4, 1.3, 1.05, 0.95, 0.9),
    CREATIVE(1.0, 0.6, 1.0, 0.95, 1.4),
    EMPATHETIC(1.3, 0.8, 1.05, 0.95, 1.2);

    private final Map<KnowledgeType, Double> bias = new EnumMap<>(KnowledgeType.class);

    Posture(double principle, double rule, double warning, double claim, double advice) {
        bias.put(KnowledgeType.PRINCIPLE, principle);
        bias.put(KnowledgeType.RULE, rule);
        bias.put(KnowledgeType.WARNING, warning);
        bias.put(KnowledgeType.CLAIM, claim);
        bias.put(KnowledgeType.ADVICE, advice);
    }

    public double bias(KnowledgeType type) {
        return bias.getOrDefault(type, 1.0);
    }
}
