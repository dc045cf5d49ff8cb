package me.golemcore.council.domain.mode;

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

import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.CouncilRecommendation;
import me.golemcore.council.domain.model.DecisionMode;
import me.golemcore.council.domain.model.ModeInterpretation;
import me.golemcore.council.domain.model.SituationAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Full court: every voting seat plus the judges, with the highest agreement
 * bar.
 */
@Component
public class DarbarModeStrategy implements ModeStrategy {

    static final double STRONG_AGREEMENT = 0.8;
    static final double NOTED_DISSENT_AGREEMENT = 0.6;

    @Override
    public DecisionMode mode() {
        return DecisionMode.DARBAR;
    }

    @Override
    public List<AdvisorId> selectAdvisors(SituationAnalysis analysis) {
        List<AdvisorId> court = new ArrayList<>(AdvisorId.voting());
        court.addAll(AdvisorId.judges());
        return List.copyOf(court);
    }

    @Override
    public ModeInterpretation interpret(CouncilRecommendation recommendation) {
        if (ModeStrategy.hasRedLine(recommendation)) {
            return ModeInterpretation.RED_LINE_BLOCKS_RECOMMENDATION;
        }
        if (recommendation.getConsensusStrength() >= STRONG_AGREEMENT) {
            return ModeInterpretation.STRONG_DOCTRINE_ALIGNED_CONSENSUS;
        }
        if (recommendation.getConsensusStrength() >= NOTED_DISSENT_AGREEMENT) {
            return ModeInterpretation.CONSENSUS_WITH_NOTED_DISSENT;
        }
        return ModeInterpretation.DEEP_DISAGREEMENT_DEFER_DECISION;
    }
}
