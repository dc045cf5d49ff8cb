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
 * Ranked knowledge selection with quality and consistency signals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeSynthesis {

    @Builder.Default
    private List<ScoredEntry> entries = new ArrayList<>();

    private double averageScore;

    /**
     * Saturating transform of the average score, always in [0, 1).
     */
    private double candidateQuality;

    @Builder.Default
    private List<Contradiction> contradictions = new ArrayList<>();

    private int totalScanned;
    private boolean fallbackUsed;

    @Builder.Default
    private KnowledgeUsage usage = new KnowledgeUsage();

    public boolean isEmpty() {
        return entries == null || entries.isEmpty();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Contradiction {
        private String firstId;
        private String secondId;
        private double domainSimilarity;
    }
}
