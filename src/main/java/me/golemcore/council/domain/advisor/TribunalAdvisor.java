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
 * Judge seat for accountability. Its position is recorded with the council
 * but never counted in the vote.
 */
@Component
public class TribunalAdvisor extends AbstractAdvisor {

    private static final List<String> ACCOUNTABILITY_WORDS = List.of(
            "responsible", "accountable", "consequences", "liable", "fault", "blame");
    private static final List<String> EVASION_WORDS = List.of(
            "not my fault", "not responsible", "someone else", "blame others", "deny");

    public TribunalAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.TRIBUNAL, Posture.ANALYTICAL, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        boolean accountable = mentions(text, ACCOUNTABILITY_WORDS);
        if (mentions(text, EVASION_WORDS)) {
            Position position = position(Stance.OPPOSE, 0.8, "Accountability evasion detected");
            position.setRedLineTriggered(!accountable);
            return position;
        }
        if (accountable) {
            return position(Stance.SUPPORT, 0.8, "Accountability acknowledged");
        }
        return position(Stance.NEUTRAL, 0.5, "Accountability neutral");
    }
}
