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
 * Supports mobilization under real threat and prefers peace otherwise.
 */
@Component
public class WarModeAdvisor extends AbstractAdvisor {

    private static final List<String> WAR_WORDS = List.of(
            "attack", "mobilize", "aggressive", "enemy", "battle", "survival");
    private static final List<String> ESCALATION_WORDS = List.of(
            "escalat", "intensify", "full force", "all hands", "total war");

    public WarModeAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.WAR_MODE, Posture.BOLD, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (mentions(text, ESCALATION_WORDS)) {
            return position(Stance.SUPPORT, 0.85, "Escalation scenario active; mobilization required");
        }
        if (mentions(text, WAR_WORDS)) {
            return position(Stance.SUPPORT, 0.7, "Conflict requires aggressive posture");
        }
        return position(Stance.OPPOSE, 0.6, "No immediate threat; prefer diplomatic approaches");
    }
}
