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
 * Tracks budgets and reserves under scarcity.
 */
@Component
public class RiskResourcesAdvisor extends AbstractAdvisor {

    private static final List<String> RESOURCE_WORDS = List.of(
            "budget", "capital", "resources", "money", "time", "energy", "reserves");
    private static final List<String> DEPLETION_WORDS = List.of(
            "everything", "all of", "run out", "running out", "empty", "spent", "shortage", "depleted");

    public RiskResourcesAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.RISK_RESOURCES, Posture.CAUTIOUS, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (mentions(text, DEPLETION_WORDS)) {
            Position position = position(Stance.OPPOSE, 0.8, "Resource depletion risk detected");
            position.setConcerns(new ArrayList<>(List.of("scarcity", "depletion")));
            return position;
        }
        if (mentions(text, RESOURCE_WORDS)) {
            return position(Stance.SUPPORT, 0.7, "Resource constraints acknowledged");
        }
        return position(Stance.NEUTRAL, 0.5, "Resource management neutral");
    }
}
