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
 * Input for one knowledge synthesis run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class KnowledgeQuery {

    private String text;

    @Builder.Default
    private List<String> activeDomains = new ArrayList<>();

    @Builder.Default
    private double domainConfidence = 0.5;

    private Posture posture;
    private SituationFrame frame;

    /**
     * When present, the learned prior for the matching situation bucket may
     * scale type weights.
     */
    private DecisionFeatures features;

    /**
     * Extra text appended to the query context, e.g. clarification answers.
     */
    @Builder.Default
    private List<String> extraContext = new ArrayList<>();

    private Integer maxItems;
}
