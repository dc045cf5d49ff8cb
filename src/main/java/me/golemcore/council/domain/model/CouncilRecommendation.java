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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduction of one decision's advisor positions into a single recommendation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CouncilRecommendation {

    public enum Outcome {
        CONSENSUS_REACHED, BOUNDED_RISK_TRADEOFF, DEADLOCKED
    }

    public enum Recommendation {
        SUPPORT, OPPOSE, DEFER, SUPPORT_WITH_CAUTION
    }

    private Outcome outcome;
    private Recommendation recommendation;
    private double avgConfidence;
    private double consensusStrength;
    private String reasoning;

    private int supportVotes;
    private int opposeVotes;
    private int neutralVotes;

    @Builder.Default
    private List<AdvisorId> dissenters = new ArrayList<>();

    @Builder.Default
    private List<String> redLineConcerns = new ArrayList<>();

    public int totalVotes() {
        return supportVotes + opposeVotes + neutralVotes;
    }
}
