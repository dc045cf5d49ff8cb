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
 * Checks the current statement against the recent conversation for
 * reversals.
 */
@Component
public class DisciplineAdvisor extends AbstractAdvisor {

    private static final int MIN_HISTORY = 3;

    public DisciplineAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.DISCIPLINE, Posture.CAUTIOUS, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        List<String> recentTurns = context.getRecentTurns();
        if (recentTurns == null || recentTurns.size() <= MIN_HISTORY) {
            return position(Stance.NEUTRAL, 0.5, "Not enough history to judge consistency");
        }
        String last = TextSupport.normalize(recentTurns.get(recentTurns.size() - 1));
        boolean reversal = (TextSupport.countWord(text, "no") > 0 && TextSupport.countWord(last, "yes") > 0)
                || (TextSupport.countWord(text, "never") > 0 && TextSupport.countWord(last, "always") > 0);
        if (reversal) {
            return position(Stance.OPPOSE, 0.8, "Contradiction detected with recent statement");
        }
        return position(Stance.SUPPORT, 0.6, "Consistent positioning maintained");
    }
}
