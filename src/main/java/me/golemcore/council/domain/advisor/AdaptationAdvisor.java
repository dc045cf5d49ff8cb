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
 * Watches for stagnation and signals that the current approach has run its
 * course.
 */
@Component
public class AdaptationAdvisor extends AbstractAdvisor {

    private static final int PERSISTENT_PATTERN_TURNS = 5;

    public AdaptationAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.ADAPTATION, Posture.CREATIVE, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        List<String> reasoning = new ArrayList<>();
        if (!context.activeDomains().isEmpty() && context.getTurnCount() > PERSISTENT_PATTERN_TURNS) {
            reasoning.add("Pattern persistence detected; adaptation may be needed");
        }
        if (knowledge.isEmpty()) {
            return position(Stance.NEUTRAL, 0.4,
                    reasoning.isEmpty() ? "No clear adaptation signal" : String.join(" | ", reasoning));
        }
        reasoning.add("Adaptation knowledge confirms change signals present");
        Position position = position(Stance.SUPPORT, 0.7, String.join(" | ", reasoning));
        position.setConcerns(new ArrayList<>(List.of("system_stagnation", "decay")));
        return position;
    }
}
