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
 * Combined understanding of one utterance: situation frame, active domains and
 * emotional metrics, plus where the reading came from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SituationAnalysis {

    public enum Source {
        UPSTREAM, HEURISTIC
    }

    @Builder.Default
    private SituationFrame frame = SituationFrame.neutral();

    @Builder.Default
    private DomainClassification classification = new DomainClassification();

    @Builder.Default
    private EmotionalMetrics metrics = new EmotionalMetrics();

    @Builder.Default
    private Source source = Source.HEURISTIC;
}
