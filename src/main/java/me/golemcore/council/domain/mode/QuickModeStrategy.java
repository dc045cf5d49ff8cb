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
 * No council sits; the caller answers directly.
 */
@Component
public class QuickModeStrategy implements ModeStrategy {

    @Override
    public DecisionMode mode() {
        return DecisionMode.QUICK;
    }

    @Override
    public List<AdvisorId> selectAdvisors(SituationAnalysis analysis) {
        return List.of();
    }

    @Override
    public boolean requiresCouncil() {
        return false;
    }

    @Override
    public ModeInterpretation interpret(CouncilRecommendation recommendation) {
        return ModeInterpretation.DIRECT_RESPONSE;
    }
}
