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

import java.util.List;

/**
 * How one decision mode picks its advisors and reads the council's result.
 */
public interface ModeStrategy {

    DecisionMode mode();

    List<AdvisorId> selectAdvisors(SituationAnalysis analysis);

    default boolean requiresCouncil() {
        return true;
    }

    ModeInterpretation interpret(CouncilRecommendation recommendation);

    static boolean hasRedLine(CouncilRecommendation recommendation) {
        return recommendation.getRedLineConcerns() != null && !recommendation.getRedLineConcerns().isEmpty();
    }
}
