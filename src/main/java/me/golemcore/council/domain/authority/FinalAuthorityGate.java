package me.golemcore.council.domain.authority;

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
import me.golemcore.council.domain.advisor.DoctrineCatalog;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.AuthorityVerdict;
import me.golemcore.council.domain.model.AuthorityVerdict.FinalOutcome;
import me.golemcore.council.domain.model.AuthorityVerdict.GateState;
import me.golemcore.council.domain.model.CouncilRecommendation;
import me.golemcore.council.domain.model.Doctrine;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Stance;
import me.golemcore.council.domain.service.TextSupport;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Last word on a council recommendation.
 *
 * <p>
 * The gate walks {@code CONSTRAINT_CHECK -> DISTORTION_CHECK -> PATTERN_CHECK
 * -> OUTCOME_EVALUATION}; the first check that objects ends the walk with a
 * verdict. The reasoning it inspects is the council's own reasoning followed
 * by every counted advisor's.
 */
@Component
@Slf4j
public class FinalAuthorityGate {

    static final double DISTORTION_CONFIDENCE = 0.7;
    static final double DISTORTION_STRENGTH = 0.3;
    static final int MAX_RATIONALIZATIONS = 2;
    static final String MORALIZING_PROHIBITION = "moraliz";

    private static final List<String> MORALIZING_WORDS = List.of(
            "should", "ought", "right", "wrong", "evil", "sin");
    private static final List<String> RATIONALIZATIONS = List.of(
            "but", "however", "despite", "still", "anyway", "regardless");

    private final Doctrine doctrine;
    private final double riskThreshold;

    public FinalAuthorityGate(DoctrineCatalog doctrineCatalog, CouncilProperties properties) {
        this.doctrine = doctrineCatalog.find(properties.getAuthority().getDoctrineName()).orElse(null);
        this.riskThreshold = properties.getAuthority().getRiskThreshold();
    }

    public AuthorityVerdict evaluate(CouncilRecommendation recommendation, Map<AdvisorId, Position> positions) {
        if (recommendation == null) {
            throw new IllegalArgumentException("Council recommendation is required");
        }
        List<GateState> path = new ArrayList<>();
        String reasoning = reasoningText(recommendation, positions);

        path.add(GateState.CONSTRAINT_CHECK);
        if (forbidsMoralizing() && countAny(reasoning, MORALIZING_WORDS) > 0) {
            return verdict(path, FinalOutcome.DEFER,
                    "Doctrine prohibits moralizing; restate the recommendation in terms of consequences");
        }

        path.add(GateState.DISTORTION_CHECK);
        if (recommendation.getAvgConfidence() > DISTORTION_CONFIDENCE
                && recommendation.getConsensusStrength() < DISTORTION_STRENGTH) {
            return verdict(path, FinalOutcome.DEFER,
                    "Emotional distortion: high stated confidence with weak agreement");
        }

        path.add(GateState.PATTERN_CHECK);
        int rationalizations = countAny(reasoning, RATIONALIZATIONS);
        if (rationalizations > MAX_RATIONALIZATIONS) {
            return verdict(path, FinalOutcome.DEFER,
                    "Pattern recurrence: " + rationalizations + " rationalizing connectives in the reasoning");
        }

        path.add(GateState.OUTCOME_EVALUATION);
        return evaluateOutcome(path, recommendation, positions);
    }

    private AuthorityVerdict evaluateOutcome(List<GateState> path, CouncilRecommendation recommendation,
            Map<AdvisorId, Position> positions) {
        Position risk = positions != null ? positions.get(AdvisorId.RISK) : null;
        if (risk != null && risk.isRedLineTriggered()) {
            return verdict(path, FinalOutcome.REJECT, "Risk red line: " + risk.getReasoning());
        }
        if (risk != null && risk.getStance() == Stance.OPPOSE && risk.getConfidence() >= riskThreshold) {
            return verdict(path, FinalOutcome.DEFER, "Risk advisor veto: " + risk.getReasoning());
        }

        double confidence = recommendation.getAvgConfidence();
        if (recommendation.getOutcome() == CouncilRecommendation.Outcome.CONSENSUS_REACHED
                && recommendation.getRecommendation() == CouncilRecommendation.Recommendation.SUPPORT
                && confidence >= riskThreshold) {
            return verdict(path, FinalOutcome.ACCEPT, "Council consensus with sufficient confidence");
        }
        if (recommendation.getOutcome() == CouncilRecommendation.Outcome.BOUNDED_RISK_TRADEOFF
                && confidence >= riskThreshold) {
            return verdict(path, FinalOutcome.ACCEPT_WITH_MITIGATION,
                    "Bounded risk tradeoff; proceed with mitigation of the dissenting concerns");
        }
        return verdict(path, FinalOutcome.DEFER, "Insufficient confidence or agreement to act");
    }

    private AuthorityVerdict verdict(List<GateState> path, FinalOutcome outcome, String reason) {
        GateState decidedIn = path.get(path.size() - 1);
        path.add(GateState.TERMINAL);
        log.debug("[Authority] {} in {}: {}", outcome, decidedIn, reason);
        return AuthorityVerdict.builder()
                .finalOutcome(outcome)
                .reason(reason)
                .decidedIn(decidedIn)
                .path(path)
                .build();
    }

    private boolean forbidsMoralizing() {
        return doctrine != null && doctrine.getProhibitions().stream()
                .anyMatch(prohibition -> TextSupport.normalize(prohibition).contains(MORALIZING_PROHIBITION));
    }

    private static int countAny(String text, List<String> words) {
        int count = 0;
        for (String word : words) {
            count += TextSupport.countWord(text, word);
        }
        return count;
    }

    private static String reasoningText(CouncilRecommendation recommendation, Map<AdvisorId, Position> positions) {
        StringBuilder text = new StringBuilder();
        if (recommendation.getReasoning() != null) {
            text.append(recommendation.getReasoning());
        }
        if (positions != null) {
            for (Position position : positions.values()) {
                if (position.getReasoning() != null) {
                    text.append(" | ").append(position.getReasoning());
                }
            }
        }
        return text.toString();
    }
}
