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
 * Holds actions to law and stated values. Illegal or unethical intent is a
 * red line.
 */
@Component
public class LegitimacyAdvisor extends AbstractAdvisor {

    private static final List<String> LEGITIMACY_WORDS = List.of(
            "authority", "right", "legal", "ethical", "values", "principle", "legitimate", "law");
    private static final List<String> ILLEGAL_WORDS = List.of(
            "illegal", "unethical", "fraud", "corrupt", "steal", "cheat");

    public LegitimacyAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.LEGITIMACY, Posture.CAUTIOUS, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        if (mentions(text, ILLEGAL_WORDS)) {
            return redLine(0.95, "Legitimacy red line");
        }
        if (mentions(text, LEGITIMACY_WORDS)) {
            return position(Stance.SUPPORT, 0.7, "Values-aligned approach");
        }
        return position(Stance.NEUTRAL, 0.5, "Legitimacy assumed");
    }
}
