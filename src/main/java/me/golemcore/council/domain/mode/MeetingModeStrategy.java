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
import me.golemcore.council.domain.service.TextSupport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A small council drawn from the active domains: the two leading seats per
 * domain, always the risk seat, between three and five seats in total.
 */
@Component
public class MeetingModeStrategy implements ModeStrategy {

    static final int MIN_SEATS = 3;
    static final int MAX_SEATS = 5;
    static final int SEATS_PER_DOMAIN = 2;

    static final Map<String, List<AdvisorId>> DOMAIN_SEATS = Map.of(
            "career", List.of(AdvisorId.GRAND_STRATEGIST, AdvisorId.PSYCHOLOGY, AdvisorId.TIMING),
            "financial", List.of(AdvisorId.RISK, AdvisorId.OPTIONALITY, AdvisorId.DATA),
            "relationships", List.of(AdvisorId.DIPLOMACY, AdvisorId.PSYCHOLOGY, AdvisorId.LEGITIMACY),
            "health", List.of(AdvisorId.PSYCHOLOGY, AdvisorId.TIMING, AdvisorId.RISK),
            "strategy", List.of(AdvisorId.GRAND_STRATEGIST, AdvisorId.INTELLIGENCE, AdvisorId.TIMING),
            "power", List.of(AdvisorId.POWER, AdvisorId.DIPLOMACY, AdvisorId.CONFLICT),
            "ethics", List.of(AdvisorId.LEGITIMACY, AdvisorId.TRUTH, AdvisorId.DISCIPLINE),
            "innovation", List.of(AdvisorId.TECHNOLOGY, AdvisorId.GRAND_STRATEGIST, AdvisorId.RISK));

    static final List<AdvisorId> PADDING = List.of(
            AdvisorId.GRAND_STRATEGIST, AdvisorId.PSYCHOLOGY, AdvisorId.TIMING);

    @Override
    public DecisionMode mode() {
        return DecisionMode.MEETING;
    }

    @Override
    public List<AdvisorId> selectAdvisors(SituationAnalysis analysis) {
        Set<AdvisorId> selected = new LinkedHashSet<>();
        List<String> domains = analysis != null && analysis.getClassification() != null
                ? analysis.getClassification().getDomains()
                : List.of();
        if (domains != null) {
            for (String domain : domains) {
                List<AdvisorId> seats = DOMAIN_SEATS.get(TextSupport.normalize(domain).trim());
                if (seats != null) {
                    selected.addAll(seats.subList(0, SEATS_PER_DOMAIN));
                }
            }
        }
        selected.add(AdvisorId.RISK);

        List<AdvisorId> council = new ArrayList<>(selected);
        for (int i = council.size() - 1; council.size() > MAX_SEATS && i >= 0; i--) {
            if (council.get(i) != AdvisorId.RISK) {
                council.remove(i);
            }
        }
        for (AdvisorId padding : PADDING) {
            if (council.size() >= MIN_SEATS) {
                break;
            }
            if (!council.contains(padding)) {
                council.add(padding);
            }
        }
        return List.copyOf(council);
    }

    @Override
    public ModeInterpretation interpret(CouncilRecommendation recommendation) {
        if (recommendation.getOutcome() == CouncilRecommendation.Outcome.CONSENSUS_REACHED) {
            if (recommendation.getRecommendation() == CouncilRecommendation.Recommendation.SUPPORT) {
                return ModeInterpretation.STRONG_CONSENSUS_SUPPORT;
            }
            if (recommendation.getRecommendation() == CouncilRecommendation.Recommendation.OPPOSE) {
                return ModeInterpretation.STRONG_CONSENSUS_OPPOSE;
            }
        }
        return ModeInterpretation.MIXED_CONSENSUS_WITH_TRADEOFFS;
    }
}
