package me.golemcore.council.domain.learning;

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
import me.golemcore.council.domain.model.InterpretedOutcome;
import me.golemcore.council.domain.model.KnowledgeType;
import me.golemcore.council.domain.model.KnowledgeUsage;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.OutcomeRecord;
import me.golemcore.council.domain.model.SituationFeatures;
import me.golemcore.council.domain.model.TypeWeights;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Turns a decision's features and its observed outcome into a bounded
 * {@link TypeWeights} label.
 *
 * <p>
 * Every rule moves one weight by a fixed step scaled by the decision's
 * severity. Deltas accumulate unclamped and the result is written once, so
 * the [0.7, 1.3] band is applied exactly at the single write.
 */
@Component
public class LabelGenerator {

    static final double RECOVERY_LONG_DAYS = 90.0;
    static final double HIGH_REGRET = 0.6;
    static final double HIGH_IRREVERSIBILITY = 0.7;
    static final double IRREVERSIBLE_DECISION_FLOOR = 0.8;
    static final double LOW_INFORMATION = 0.5;

    public InterpretedOutcome interpretOutcome(OutcomeRecord outcome) {
        return InterpretedOutcome.builder()
                .success(outcome.isSuccess())
                .regret(clamp01(outcome.getRegretScore()))
                .recoveryLong(outcome.getRecoveryTimeDays() > RECOVERY_LONG_DAYS)
                .secondaryDamage(outcome.isSecondaryDamage())
                .build();
    }

    /**
     * Weighted severity of a decision in [0, 1]: irreversibility 0.4, downside
     * asymmetry 0.3, fragility 0.2, time pressure 0.1.
     */
    public double severity(SituationFeatures situation, ConstraintFeatures constraints) {
        double raw = 0.4 * effectiveIrreversibility(situation, constraints)
                + 0.3 * constraints.getDownsideAsymmetry()
                + 0.2 * constraints.getFragilityScore()
                + 0.1 * situation.getTimePressure();
        return clamp01(raw);
    }

    public TypeWeights generateTypeWeights(DecisionFeatures features, OutcomeRecord outcome) {
        SituationFeatures situation = features.getSituation() != null
                ? features.getSituation()
                : new SituationFeatures();
        ConstraintFeatures constraints = features.getConstraints() != null
                ? features.getConstraints()
                : new ConstraintFeatures();
        KnowledgeUsage usage = features.getKnowledge() != null
                ? features.getKnowledge()
                : new KnowledgeUsage();

        InterpretedOutcome interpreted = interpretOutcome(outcome);
        double s = severity(situation, constraints);
        Map<KnowledgeType, Double> weights = new EnumMap<>(KnowledgeType.class);
        for (KnowledgeType type : KnowledgeType.values()) {
            weights.put(type, 1.0);
        }

        if (!interpreted.isSuccess()) {
            if (effectiveIrreversibility(situation, constraints) > HIGH_IRREVERSIBILITY) {
                adjust(weights, KnowledgeType.WARNING, 0.3 * s);
                adjust(weights, KnowledgeType.PRINCIPLE, 0.2 * s);
            }
            if (situation.isIrreversible() && usage.uses(KnowledgeType.RULE)) {
                adjust(weights, KnowledgeType.RULE, -0.2 * s);
            }
            if (usage.uses(KnowledgeType.ADVICE)) {
                adjust(weights, KnowledgeType.ADVICE, -0.3 * s);
            }
            if (situation.getInformationCompleteness() < LOW_INFORMATION) {
                adjust(weights, KnowledgeType.CLAIM, -0.1 * s);
            }
        } else {
            if (situation.isIrreversible()) {
                adjust(weights, KnowledgeType.PRINCIPLE, 0.2 * s);
            }
            if (usage.uses(KnowledgeType.WARNING)
                    && situation.getTimeHorizon() == SituationFeatures.TimeHorizon.LONG) {
                adjust(weights, KnowledgeType.WARNING, 0.2 * s);
            }
            if (usage.uses(KnowledgeType.RULE) && situation.getRiskLevel() != Level.HIGH) {
                adjust(weights, KnowledgeType.RULE, 0.2 * s);
            }
        }

        if (interpreted.getRegret() > HIGH_REGRET) {
            adjust(weights, KnowledgeType.ADVICE, -0.2 * s);
            adjust(weights, KnowledgeType.RULE, -0.1 * s);
        }
        if (interpreted.isRecoveryLong()) {
            adjust(weights, KnowledgeType.WARNING, 0.2 * s);
            adjust(weights, KnowledgeType.PRINCIPLE, 0.1 * s);
        }
        if (interpreted.isSecondaryDamage()) {
            adjust(weights, KnowledgeType.PRINCIPLE, -0.15 * s);
        }

        return TypeWeights.of(weights);
    }

    private double effectiveIrreversibility(SituationFeatures situation, ConstraintFeatures constraints) {
        double score = clamp01(constraints.getIrreversibilityScore());
        return situation.isIrreversible() ? Math.max(score, IRREVERSIBLE_DECISION_FLOOR) : score;
    }

    private static void adjust(Map<KnowledgeType, Double> weights, KnowledgeType type, double delta) {
        weights.merge(type, delta, Double::sum);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
