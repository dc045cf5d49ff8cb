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

/**
 * Structured reading of the current situation, as delivered by the text
 * understanding collaborator or the local heuristics.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SituationFrame {

    public enum SituationType {
        CASUAL, EMOTIONAL, DECISION, UNCLEAR
    }

    @Builder.Default
    private SituationType situationType = SituationType.UNCLEAR;

    private double clarity;
    private double emotionalLoad;

    private String domain;

    @Builder.Default
    private Level stakes = Level.LOW;

    @Builder.Default
    private Level timePressure = Level.LOW;

    public static SituationFrame neutral() {
        return SituationFrame.builder()
                .situationType(SituationType.UNCLEAR)
                .clarity(0.5)
                .emotionalLoad(0.0)
                .build();
    }
}
