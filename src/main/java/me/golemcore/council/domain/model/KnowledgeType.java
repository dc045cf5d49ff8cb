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

/**
 * Kind of statement a knowledge entry makes. Each kind carries the fixed base
 * weight used by the scoring engine before posture and learned adjustments.
 */
public enum KnowledgeType {

    PRINCIPLE(1.0),
    RULE(1.1),
    WARNING(1.05),
    CLAIM(0.95),
    ADVICE(0.9);

    private final double baseWeight;

    KnowledgeType(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double getBaseWeight() {
        return baseWeight;
    }
}
