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
 * Judges whether this is the moment to act. Leans toward patience.
 */
@Component
public class TimingAdvisor extends AbstractAdvisor {

    private static final List<String> HASTE_WORDS = List.of(
            "now", "immediately");
    private static final List<String> PATIENCE_WORDS = List.of(
            "delay", "wait");

    public TimingAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.TIMING, Posture.CAUTIOUS, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (mentions(text, HASTE_WORDS)) {
            return position(Stance.OPPOSE, 0.7, "Excessive urgency detected; urge patience");
        }
        if (mentions(text, PATIENCE_WORDS)) {
            return position(Stance.SUPPORT, 0.6, "Adequate preparation time available");
        }
        return position(Stance.NEUTRAL, 0.5, "Timing neutral");
    }
}
