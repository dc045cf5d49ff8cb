package me.golemcore.council.domain.analysis;

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

import me.golemcore.council.domain.model.ConstraintFeatures;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.EmotionalMetrics;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.KnowledgeUsage;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.domain.model.SituationFeatures;
import me.golemcore.council.domain.model.SituationFrame;
import me.golemcore.council.domain.service.TextSupport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the decision features used for outcome labeling and prior buckets
 * from the input text, its analysis and the knowledge that was consulted.
 */
@Component
public class FeatureExtractor {

    static final double IRREVERSIBLE_SCORE = 0.85;
    static final double REVERSIBLE_SCORE = 0.2;
    static final double EXPLORATORY_SCORE = 0.5;
    static final double OPTIONALITY_LOSS = 0.7;

    private static final List<String> IRREVERSIBLE_MARKERS = List.of(
            "quit", "resign", "divorce", "break up", "end relationship", "burn bridges", "relocate", "move",
            "surgery", "irreversible");
    private static final List<String> REVERSIBLE_MARKERS = List.of(
            "try", "experiment", "test", "apply", "propose", "request", "negotiate", "consider", "explore",
            "think about");
    private static final List<String> LONG_HORIZON_MARKERS = List.of(
            "long-term", "long term", "years", "decade", "retire", "future", "lifetime");
    private static final List<String> SHORT_HORIZON_MARKERS = List.of(
            "today", "tonight", "tomorrow", "this week", "short-term", "short term", "right now", "temporary");
    private static final List<String> COMMITMENT_MARKERS = List.of(
            "commit", "sign", "contract", "all in", "lock in", "mortgage", "marry", "invest everything");

    public DecisionFeatures extract(String input, SituationAnalysis analysis, KnowledgeSynthesis knowledge) {
        String text = TextSupport.normalize(input);
        SituationAnalysis safeAnalysis = analysis != null ? analysis : new SituationAnalysis();
        SituationFrame frame = safeAnalysis.getFrame() != null ? safeAnalysis.getFrame() : SituationFrame.neutral();
        EmotionalMetrics metrics = safeAnalysis.getMetrics() != null
                ? safeAnalysis.getMetrics()
                : new EmotionalMetrics();

        SituationFeatures.DecisionType decisionType = decisionType(text);
        Level risk = frame.getStakes() != null ? frame.getStakes() : Level.LOW;

        SituationFeatures situation = SituationFeatures.builder()
                .decisionType(decisionType)
                .riskLevel(risk)
                .timeHorizon(timeHorizon(text))
                .timePressure(levelScore(frame.getTimePressure(), 0.2, 0.5, 0.9))
                .informationCompleteness(frame.getClarity())
                .build();

        ConstraintFeatures constraints = ConstraintFeatures.builder()
                .irreversibilityScore(irreversibility(decisionType))
                .fragilityScore(Math.max(metrics.getStress(), metrics.getVolatility()))
                .optionalityLossScore(TextSupport.containsAny(text, COMMITMENT_MARKERS) ? OPTIONALITY_LOSS : 0.0)
                .downsideAsymmetry(levelScore(risk, 0.3, 0.5, 0.8))
                .upsideAsymmetry(decisionType == SituationFeatures.DecisionType.REVERSIBLE ? 0.6 : 0.4)
                .build();

        KnowledgeUsage usage = knowledge != null && knowledge.getUsage() != null
                ? knowledge.getUsage()
                : new KnowledgeUsage();

        return DecisionFeatures.builder()
                .situation(situation)
                .constraints(constraints)
                .knowledge(usage)
                .build();
    }

    SituationFeatures.DecisionType decisionType(String text) {
        if (TextSupport.containsAny(text, IRREVERSIBLE_MARKERS)) {
            return SituationFeatures.DecisionType.IRREVERSIBLE;
        }
        if (TextSupport.countMatches(text, REVERSIBLE_MARKERS) >= 2) {
            return SituationFeatures.DecisionType.REVERSIBLE;
        }
        return SituationFeatures.DecisionType.EXPLORATORY;
    }

    private static SituationFeatures.TimeHorizon timeHorizon(String text) {
        if (TextSupport.containsAny(text, LONG_HORIZON_MARKERS)) {
            return SituationFeatures.TimeHorizon.LONG;
        }
        if (TextSupport.containsAny(text, SHORT_HORIZON_MARKERS)) {
            return SituationFeatures.TimeHorizon.SHORT;
        }
        return SituationFeatures.TimeHorizon.MEDIUM;
    }

    private static double irreversibility(SituationFeatures.DecisionType type) {
        return switch (type) {
            case IRREVERSIBLE -> IRREVERSIBLE_SCORE;
            case REVERSIBLE -> REVERSIBLE_SCORE;
            case EXPLORATORY -> EXPLORATORY_SCORE;
        };
    }

    private static double levelScore(Level level, double low, double medium, double high) {
        if (level == null) {
            return low;
        }
        return switch (level) {
            case LOW -> low;
            case MEDIUM -> medium;
            case HIGH -> high;
        };
    }
}
