package me.golemcore.council.domain.council;

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
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Stance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reduces counted advisor positions into one recommendation.
 *
 * <p>
 * Rules apply in order: any red line opposes outright; a side holding at least
 * 60% of the votes and outnumbering the other wins; a split council supports
 * with caution; otherwise the council is deadlocked. Stateless.
 */
@Component
public class CouncilAggregator {

    static final double RED_LINE_STRENGTH = 0.95;
    static final double QUORUM = 0.6;
    static final double DEFAULT_CONFIDENCE = 0.5;

    public CouncilRecommendation aggregate(Map<AdvisorId, Position> positions) {
        List<Position> votes = positions == null ? List.of() : new ArrayList<>(positions.values());
        double avgConfidence = votes.stream().mapToDouble(Position::getConfidence).average()
                .orElse(DEFAULT_CONFIDENCE);

        List<Position> redLines = votes.stream().filter(Position::isRedLineTriggered).toList();
        int support = count(votes, Stance.SUPPORT);
        int oppose = count(votes, Stance.OPPOSE);
        int neutral = votes.size() - support - oppose;

        CouncilRecommendation.CouncilRecommendationBuilder builder = CouncilRecommendation.builder()
                .avgConfidence(avgConfidence)
                .supportVotes(support)
                .opposeVotes(oppose)
                .neutralVotes(neutral);

        if (!redLines.isEmpty()) {
            List<String> concerns = redLines.stream()
                    .map(position -> position.getAdvisor().key() + ": " + position.getReasoning())
                    .toList();
            return builder
                    .outcome(CouncilRecommendation.Outcome.CONSENSUS_REACHED)
                    .recommendation(CouncilRecommendation.Recommendation.OPPOSE)
                    .consensusStrength(RED_LINE_STRENGTH)
                    .reasoning("Red line triggered by " + String.join("; ", concerns))
                    .redLineConcerns(new ArrayList<>(concerns))
                    .dissenters(dissenters(votes, Stance.SUPPORT))
                    .build();
        }

        int total = votes.size();
        if (total > 0 && support > oppose && support >= QUORUM * total) {
            return builder
                    .outcome(CouncilRecommendation.Outcome.CONSENSUS_REACHED)
                    .recommendation(CouncilRecommendation.Recommendation.SUPPORT)
                    .consensusStrength((double) support / total)
                    .reasoning("Council supports: " + support + " of " + total + " advisors in favour")
                    .dissenters(dissenters(votes, Stance.OPPOSE))
                    .build();
        }
        if (total > 0 && oppose > support && oppose >= QUORUM * total) {
            return builder
                    .outcome(CouncilRecommendation.Outcome.CONSENSUS_REACHED)
                    .recommendation(CouncilRecommendation.Recommendation.OPPOSE)
                    .consensusStrength((double) oppose / total)
                    .reasoning("Council opposes: " + oppose + " of " + total + " advisors against")
                    .dissenters(dissenters(votes, Stance.SUPPORT))
                    .build();
        }
        if (support > 0 && oppose > 0) {
            return builder
                    .outcome(CouncilRecommendation.Outcome.BOUNDED_RISK_TRADEOFF)
                    .recommendation(CouncilRecommendation.Recommendation.SUPPORT_WITH_CAUTION)
                    .consensusStrength((double) Math.max(support, oppose) / total)
                    .reasoning("Split council: " + support + " support, " + oppose + " oppose, " + neutral
                            + " neutral")
                    .dissenters(dissenters(votes, Stance.OPPOSE))
                    .build();
        }
        return builder
                .outcome(CouncilRecommendation.Outcome.DEADLOCKED)
                .recommendation(CouncilRecommendation.Recommendation.DEFER)
                .consensusStrength(0.0)
                .reasoning(total == 0 ? "No advisor responded" : "No majority emerged")
                .build();
    }

    private static int count(List<Position> votes, Stance stance) {
        return (int) votes.stream().filter(position -> position.getStance() == stance).count();
    }

    private static List<AdvisorId> dissenters(List<Position> votes, Stance dissentingStance) {
        return new ArrayList<>(votes.stream()
                .filter(position -> position.getStance() == dissentingStance)
                .map(Position::getAdvisor)
                .toList());
    }
}
