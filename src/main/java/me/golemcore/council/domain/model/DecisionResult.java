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
 * Outcome of one pass through the pipeline. In quick mode no council sits, so
 * {@code recommendation} and {@code verdict} are null and
 * {@code interpretation} is {@link ModeInterpretation#DIRECT_RESPONSE}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionResult {

    private String decisionKey;
    private DecisionMode mode;
    private SituationAnalysis analysis;

    @Builder.Default
    private List<AdvisorId> advisorsInvolved = new ArrayList<>();

    @Builder.Default
    private List<OmittedAdvisor> omittedAdvisors = new ArrayList<>();

    private CouncilSession council;
    private CouncilRecommendation recommendation;
    private ModeInterpretation interpretation;
    private AuthorityVerdict verdict;
    private DecisionFeatures features;

    /**
     * Set when the consulted knowledge was too weak; asking it would sharpen
     * the next decision.
     */
    private String clarifyingQuestion;
    private boolean recorded;
}
