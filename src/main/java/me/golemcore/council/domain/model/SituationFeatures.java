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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Discretized description of the decision being made.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SituationFeatures {

    public enum DecisionType {
        IRREVERSIBLE, REVERSIBLE, EXPLORATORY
    }

    public enum TimeHorizon {
        SHORT, MEDIUM, LONG
    }

    @Builder.Default
    private DecisionType decisionType = DecisionType.EXPLORATORY;

    @Builder.Default
    private Level riskLevel = Level.LOW;

    @Builder.Default
    private TimeHorizon timeHorizon = TimeHorizon.MEDIUM;

    private double timePressure;
    private double informationCompleteness;

    @JsonIgnore
    public boolean isIrreversible() {
        return decisionType == DecisionType.IRREVERSIBLE;
    }
}
