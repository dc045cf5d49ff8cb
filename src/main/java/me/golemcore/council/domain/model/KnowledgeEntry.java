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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed knowledge statement with provenance and reinforcement memory.
 *
 * <p>
 * Entries are created when the knowledge base loads. Only {@link MemoryStats}
 * changes afterwards, and the store replaces it with a fresh copy rather than
 * mutating the instance a reader may hold.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class KnowledgeEntry {

    private String id;
    private String domain;
    private KnowledgeType type;
    private String content;
    private KnowledgeSource source;

    @Builder.Default
    private MemoryStats memory = new MemoryStats();

    @Builder.Default
    private List<String> conceptTags = new ArrayList<>();

    @Builder.Default
    private List<String> goalTags = new ArrayList<>();

    private Applicability applicability;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class KnowledgeSource {
        private String book;
        private String file;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder(toBuilder = true)
    public static class MemoryStats {
        private int reinforcementCount;
        private int penaltyCount;
        private Instant lastReinforcedAt;
    }

    /**
     * Situations an entry may be applied to. Empty lists and null levels mean
     * no constraint on that axis.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Applicability {

        @Builder.Default
        private List<String> requiredDomains = new ArrayList<>();

        @Builder.Default
        private List<String> excludedDomains = new ArrayList<>();

        private Level minStakes;
        private Level maxTimePressure;
    }
}
