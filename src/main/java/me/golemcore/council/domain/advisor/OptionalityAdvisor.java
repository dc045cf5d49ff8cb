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
 * Protects exits and alternatives; objects to lock-in.
 */
@Component
public class OptionalityAdvisor extends AbstractAdvisor {

    private static final List<String> COMMITMENT_WORDS = List.of(
            "forever", "never go back", "all-in", "all in", "burn bridges", "irreversible");
    private static final List<String> OPTIONALITY_WORDS = List.of(
            "option", "exit", "flexibility", "retreat", "alternative", "backup");

    public OptionalityAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.OPTIONALITY, Posture.CAUTIOUS, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        boolean optionality = mentions(text, OPTIONALITY_WORDS);
        if (mentions(text, COMMITMENT_WORDS) && !optionality) {
            Position position = position(Stance.OPPOSE, 0.8, "Excessive commitment detected; losing optionality");
            position.setConcerns(new ArrayList<>(List.of("irreversibility", "exit_collapse")));
            return position;
        }
        if (optionality) {
            return position(Stance.SUPPORT, 0.8, "Strategic optionality preserved");
        }
        return position(Stance.NEUTRAL, 0.5, "Optionality neutral");
    }
}
