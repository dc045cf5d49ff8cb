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
 * Read-only context shared by every advisor evaluating one decision.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionContext {

    @Builder.Default
    private SituationAnalysis analysis = new SituationAnalysis();

    /**
     * Previous user utterances, oldest first.
     */
    @Builder.Default
    private List<String> recentTurns = new ArrayList<>();

    private int turnCount;

    private DecisionFeatures features;

    public List<String> activeDomains() {
        return analysis.getClassification().getDomains();
    }

    public SituationFrame frame() {
        return analysis.getFrame();
    }
}
