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
 * Guards against downside scenarios. Catastrophic-loss language is a red line
 * that no vote count can outweigh.
 */
@Component
public class RiskAdvisor extends AbstractAdvisor {

    private static final List<String> RISK_WORDS = List.of(
            "risk", "danger", "loss", "failure", "crash", "bankrupt", "catastrophe", "expensive");
    private static final List<String> CRITICAL_WORDS = List.of(
            "bankruptcy", "death", "total loss", "irreversible", "extinction");

    public RiskAdvisor(DoctrineCatalog doctrineCatalog, KnowledgeScoringService knowledgeScoring) {
        super(AdvisorId.RISK, Posture.CAUTIOUS, doctrineCatalog, knowledgeScoring);
    }

    @Override
    protected Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge) {
        boolean riskLanguage = mentions(text, RISK_WORDS);
        Position position;
        if (mentions(text, CRITICAL_WORDS)) {
            position = redLine(0.95, "Critical risk detected");
        } else if (riskLanguage) {
            position = position(Stance.OPPOSE, 0.75, "Significant risk present");
        } else {
            return position(Stance.SUPPORT, 0.5, "Risk profile acceptable");
        }
        if (riskLanguage) {
            position.setConcerns(new ArrayList<>(List.of("downside_scenarios", "loss_prevention")));
        }
        return position;
    }
}
