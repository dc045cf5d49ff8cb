package me.golemcore.council.domain.analysis;

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

import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.springframework.stereotype.Service;

/**
 * Opens clarification loops configured from {@code council.clarification}.
 */
@Service
public class ClarificationService {

    private final KnowledgeScoringService knowledgeScoring;
    private final SituationHeuristics heuristics;
    private final CouncilProperties properties;

    public ClarificationService(KnowledgeScoringService knowledgeScoring, SituationHeuristics heuristics,
            CouncilProperties properties) {
        this.knowledgeScoring = knowledgeScoring;
        this.heuristics = heuristics;
        this.properties = properties;
    }

    public ClarificationLoop start(KnowledgeQuery query) {
        CouncilProperties.ClarificationProperties clarification = properties.getClarification();
        return new ClarificationLoop(knowledgeScoring, heuristics, clarification.getMaxRounds(),
                clarification.getQualityThreshold(), query);
    }
}
