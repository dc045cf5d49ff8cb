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
import me.golemcore.council.domain.service.TextSupport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Looks for a coherent story across the recent conversation.
 */
@Component
public class NarrativeAdvisor extends AbstractAdvisor {

    private static final List<String> NARRATIVE_WORDS = List.of(
            "story", "narrative", "coherent", "consistent", "arc", "plot", "theme", "meaning");
    private static final int WINDOW = 3;
    private static final int MAX_CONTRADICTIONS = 3;

    public NarrativeAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.NARRATIVE, Posture.CREATIVE, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (!isConsistent(context.getRecentTurns())) {
            return position(Stance.OPPOSE, 0.7, "Narrative contradictions detected");
        }
        if (mentions(text, NARRATIVE_WORDS)) {
            return position(Stance.SUPPORT, 0.7, "Strong narrative coherence");
        }
        return position(Stance.NEUTRAL, 0.5, "Narrative neutral");
    }

    private boolean isConsistent(List<String> recentTurns) {
        if (recentTurns == null || recentTurns.size() < WINDOW) {
            return true;
        }
        String recent = String.join(" ", recentTurns.subList(recentTurns.size() - WINDOW, recentTurns.size()));
        int contradictions = TextSupport.countWord(recent, "but") + TextSupport.countWord(recent, "however");
        return contradictions < MAX_CONTRADICTIONS;
    }
}
