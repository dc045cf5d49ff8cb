package me.golemcore.council.domain.learning;

import me.golemcore.council.domain.model.ConstraintFeatures;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.InterpretedOutcome;
import me.golemcore.council.domain.model.KnowledgeType;
import me.golemcore.council.domain.model.KnowledgeUsage;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.OutcomeRecord;
import me.golemcore.council.domain.model.SituationFeatures;
import me.golemcore.council.domain.model.TypeWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelGeneratorTest {

    private static final double EPSILON = 1e-9;

    private LabelGenerator labelGenerator;

    @BeforeEach
    void setUp() {
        labelGenerator = new LabelGenerator();
    }

    @Test
    void shouldRaiseWarningAndPrincipleAfterFailedIrreversibleDecision() {
        DecisionFeatures features = features(SituationFeatures.DecisionType.IRREVERSIBLE, 0.85, 0.8, 0.5, 0.5, 0.8,
                Set.of());
        OutcomeRecord outcome = OutcomeRecord.builder().success(false).build();

        TypeWeights weights = labelGenerator.generateTypeWeights(features, outcome);

        double severity = 0.4 * 0.85 + 0.3 * 0.8 + 0.2 * 0.5 + 0.1 * 0.5;
        assertEquals(1.0 + 0.3 * severity, weights.get(KnowledgeType.WARNING), EPSILON);
        assertEquals(1.0 + 0.2 * severity, weights.get(KnowledgeType.PRINCIPLE), EPSILON);
        assertEquals(1.0, weights.get(KnowledgeType.RULE), EPSILON);
        assertEquals(1.0, weights.get(KnowledgeType.CLAIM), EPSILON);
        assertEquals(1.0, weights.get(KnowledgeType.ADVICE), EPSILON);
    }

    @Test
    void shouldClampAdjustmentsToWeightBand() {
        DecisionFeatures features = features(SituationFeatures.DecisionType.IRREVERSIBLE, 1.0, 1.0, 1.0, 1.0, 0.8,
                Set.of(KnowledgeType.ADVICE));
        OutcomeRecord outcome = OutcomeRecord.builder()
                .success(false)
                .regretScore(0.9)
                .recoveryTimeDays(120)
                .build();

        TypeWeights weights = labelGenerator.generateTypeWeights(features, outcome);

        assertEquals(TypeWeights.MAX_WEIGHT, weights.get(KnowledgeType.WARNING), EPSILON);
        assertEquals(TypeWeights.MAX_WEIGHT, weights.get(KnowledgeType.PRINCIPLE), EPSILON);
        assertEquals(TypeWeights.MIN_WEIGHT, weights.get(KnowledgeType.ADVICE), EPSILON);
        assertEquals(0.9, weights.get(KnowledgeType.RULE), EPSILON);
    }

    @Test
    void shouldApplyIrreversibilityFloorForIrreversibleDecisions() {
        SituationFeatures situation = SituationFeatures.builder()
                .decisionType(SituationFeatures.DecisionType.IRREVERSIBLE)
                .build();

        double severity = labelGenerator.severity(situation, new ConstraintFeatures());

        assertEquals(0.4 * 0.8, severity, EPSILON);
    }

    @Test
    void shouldReinforceUsedRuleAfterSuccessfulLowRiskDecision() {
        DecisionFeatures features = features(SituationFeatures.DecisionType.REVERSIBLE, 0.2, 0.5, 0.0, 0.0, 0.8,
                Set.of(KnowledgeType.RULE));
        features.getSituation().setRiskLevel(Level.MEDIUM);
        OutcomeRecord outcome = OutcomeRecord.builder().success(true).build();

        TypeWeights weights = labelGenerator.generateTypeWeights(features, outcome);

        double severity = 0.4 * 0.2 + 0.3 * 0.5;
        assertEquals(1.0 + 0.2 * severity, weights.get(KnowledgeType.RULE), EPSILON);
        assertEquals(1.0, weights.get(KnowledgeType.PRINCIPLE), EPSILON);
    }

    @Test
    void shouldPenalizeClaimsWhenInformationWasThin() {
        DecisionFeatures features = features(SituationFeatures.DecisionType.EXPLORATORY, 0.5, 0.5, 0.5, 0.5, 0.2,
                Set.of());
        OutcomeRecord outcome = OutcomeRecord.builder().success(false).build();

        TypeWeights weights = labelGenerator.generateTypeWeights(features, outcome);

        assertTrue(weights.get(KnowledgeType.CLAIM) < 1.0);
        assertEquals(1.0, weights.get(KnowledgeType.WARNING), EPSILON);
    }

    @Test
    void shouldInterpretOutcome() {
        InterpretedOutcome interpreted = labelGenerator.interpretOutcome(OutcomeRecord.builder()
                .success(true)
                .regretScore(1.7)
                .recoveryTimeDays(91)
                .secondaryDamage(true)
                .build());

        assertTrue(interpreted.isSuccess());
        assertEquals(1.0, interpreted.getRegret(), EPSILON);
        assertTrue(interpreted.isRecoveryLong());
        assertTrue(interpreted.isSecondaryDamage());

        assertFalse(labelGenerator.interpretOutcome(OutcomeRecord.builder().recoveryTimeDays(90).build())
                .isRecoveryLong());
    }

    private static DecisionFeatures features(SituationFeatures.DecisionType type, double irreversibility,
            double downside, double fragility, double timePressure, double completeness, Set<KnowledgeType> used) {
        return DecisionFeatures.builder()
                .situation(SituationFeatures.builder()
                        .decisionType(type)
                        .timePressure(timePressure)
                        .informationCompleteness(completeness)
                        .build())
                .constraints(ConstraintFeatures.builder()
                        .irreversibilityScore(irreversibility)
                        .downsideAsymmetry(downside)
                        .fragilityScore(fragility)
                        .build())
                .knowledge(KnowledgeUsage.builder().usedTypes(new LinkedHashSet<>(used)).build())
                .build();
    }
}
