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
 * Keeps human factors in view and objects when they are dismissed.
 */
@Component
public class PsychologyAdvisor extends AbstractAdvisor {

    private static final List<String> PSYCHOLOGY_WORDS = List.of(
            "feel", "emotion", "fear", "trust", "motivation", "belief", "psychology", "mental");
    private static final List<String> DENIAL_WORDS = List.of(
            "don't care", "no emotion", "purely logical", "irrelevant");

    public PsychologyAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.PSYCHOLOGY, Posture.EMPATHETIC, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (mentions(text, DENIAL_WORDS)) {
            return position(Stance.OPPOSE, 0.7, "Human factors being dismissed");
        }
        if (mentions(text, PSYCHOLOGY_WORDS)) {
            return position(Stance.SUPPORT, 0.7, "Psychological factors acknowledged");
        }
        return position(Stance.NEUTRAL, 0.5, "Psychology neutral");
    }
}
