package me.golemcore.council.domain.advisor;

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
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Posture;
import me.golemcore.council.domain.model.Stance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewards awareness of unknowns and hidden factors.
 */
@Component
public class IntelligenceAdvisor extends AbstractAdvisor {

    private static final List<String> AWARENESS_WORDS = List.of(
            "unknown", "unclear", "hidden", "uncertain", "risk", "threat", "monitor");

    public IntelligenceAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.INTELLIGENCE, Posture.ANALYTICAL, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (mentions(text, AWARENESS_WORDS)) {
            return position(Stance.SUPPORT, 0.75, "Awareness of information gaps present");
        }
        Position position = position(Stance.OPPOSE, 0.6, "Potential information blindness");
        position.setConcerns(new ArrayList<>(List.of("information_gaps", "hidden_risks")));
        return position;
    }
}
