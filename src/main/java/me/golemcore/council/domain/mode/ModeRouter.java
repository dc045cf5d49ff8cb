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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.CouncilRecommendation;
import me.golemcore.council.domain.model.DecisionMode;
import me.golemcore.council.domain.model.ModeInterpretation;
import me.golemcore.council.domain.model.RoutingPlan;
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps a mode and a situation to the advisors that should sit. The selected
 * mode is the only state it keeps.
 */
@Service
@Slf4j
public class ModeRouter {

    private final Map<DecisionMode, ModeStrategy> strategies = new EnumMap<>(DecisionMode.class);
    private final AtomicReference<DecisionMode> currentMode;

    public ModeRouter(List<ModeStrategy> strategies, CouncilProperties properties) {
        for (ModeStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
        for (DecisionMode mode : DecisionMode.values()) {
            if (!this.strategies.containsKey(mode)) {
                throw new IllegalStateException("No strategy registered for mode " + mode);
            }
        }
        DecisionMode initial = properties.getMode().getDefaultMode();
        this.currentMode = new AtomicReference<>(initial != null ? initial : DecisionMode.MEETING);
    }

    public DecisionMode getMode() {
        return currentMode.get();
    }

    public DecisionMode setMode(DecisionMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Mode is required");
        }
        DecisionMode previous = currentMode.getAndSet(mode);
        if (previous != mode) {
            log.info("[Council] Decision mode changed: {} -> {}", previous, mode);
        }
        return mode;
    }

    public RoutingPlan route(SituationAnalysis analysis) {
        return route(currentMode.get(), analysis);
    }

    public RoutingPlan route(DecisionMode mode, SituationAnalysis analysis) {
        ModeStrategy strategy = strategy(mode);
        return RoutingPlan.builder()
                .mode(strategy.mode())
                .advisors(new ArrayList<>(strategy.selectAdvisors(analysis)))
                .councilRequired(strategy.requiresCouncil())
                .build();
    }

    public ModeInterpretation interpret(DecisionMode mode, CouncilRecommendation recommendation) {
        ModeStrategy strategy = strategy(mode);
        if (!strategy.requiresCouncil() || recommendation == null) {
            return ModeInterpretation.DIRECT_RESPONSE;
        }
        return strategy.interpret(recommendation);
    }

    private ModeStrategy strategy(DecisionMode mode) {
        DecisionMode effective = mode != null ? mode : currentMode.get();
        return strategies.get(effective);
    }
}
