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

import java.util.List;

/**
 * Reads adversarial dynamics and cautions against escalation.
 */
@Component
public class ConflictAdvisor extends AbstractAdvisor {

    private static final List<String> CONFLICT_WORDS = List.of(
            "vs", "against", "opposing", "competing", "threat", "attack", "defensive");

    public ConflictAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.CONFLICT, Posture.BOLD, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (!mentions(text, CONFLICT_WORDS)) {
            return position(Stance.NEUTRAL, 0.5, "No conflict signal present");
        }
        Position position = position(Stance.OPPOSE, 0.8, "Adversarial language detected");
        position.setRedLineTriggered(mentions(text, List.of("attack")));
        return position;
    }
}
