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

import java.util.List;

/**
 * Five fixed seats for fast, high-pressure calls. The result reads as proceed
 * or hold, unless a red line needs an explicit override.
 */
@Component
public class WarModeStrategy implements ModeStrategy {

    static final List<AdvisorId> WAR_CABINET = List.of(
            AdvisorId.RISK, AdvisorId.POWER, AdvisorId.GRAND_STRATEGIST, AdvisorId.TECHNOLOGY, AdvisorId.TIMING);

    @Override
    public DecisionMode mode() {
        return DecisionMode.WAR;
    }

    @Override
    public List<AdvisorId> selectAdvisors(SituationAnalysis analysis) {
        return WAR_CABINET;
    }

    @Override
    public ModeInterpretation interpret(CouncilRecommendation recommendation) {
        if (ModeStrategy.hasRedLine(recommendation)) {
            return ModeInterpretation.RED_LINE_BLOCK_OVERRIDE_NEEDED;
        }
        CouncilRecommendation.Recommendation verdict = recommendation.getRecommendation();
        if (verdict == CouncilRecommendation.Recommendation.SUPPORT
                || verdict == CouncilRecommendation.Recommendation.SUPPORT_WITH_CAUTION) {
            return ModeInterpretation.AGGRESSIVE_PROCEED;
        }
        return ModeInterpretation.DEFENSIVE_HOLD_OR_PIVOT;
    }
}
