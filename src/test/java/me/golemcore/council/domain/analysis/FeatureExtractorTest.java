package me.golemcore.council.domain.analysis;

import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.EmotionalMetrics;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.KnowledgeType;
import me.golemcore.council.domain.model.KnowledgeUsage;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.domain.model.SituationFeatures;
import me.golemcore.council.domain.model.SituationFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureExtractorTest {

    private static final double EPSILON = 1e-9;

    private FeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new FeatureExtractor();
    }

    @Test
    void shouldExtractIrreversibleHighRiskDecision() {
        SituationAnalysis analysis = SituationAnalysis.builder()
                .frame(SituationFrame.builder()
                        .stakes(Level.HIGH)
                        .timePressure(Level.MEDIUM)
                        .clarity(0.7)
                        .build())
                .metrics(EmotionalMetrics.builder().stress(0.3).volatility(0.15).build())
                .build();

        DecisionFeatures features = extractor.extract("I want to quit and relocate for a new job", analysis, null);

        SituationFeatures situation = features.getSituation();
        assertEquals(SituationFeatures.DecisionType.IRREVERSIBLE, situation.getDecisionType());
        assertEquals(Level.HIGH, situation.getRiskLevel());
        assertEquals(SituationFeatures.TimeHorizon.MEDIUM, situation.getTimeHorizon());
        assertEquals(0.5, situation.getTimePressure(), EPSILON);
        assertEquals(0.7, situation.getInformationCompleteness(), EPSILON);
        assertEquals(0.85, features.getConstraints().getIrreversibilityScore(), EPSILON);
        assertEquals(0.3, features.getConstraints().getFragilityScore(), EPSILON);
        assertEquals(0.8, features.getConstraints().getDownsideAsymmetry(), EPSILON);
        assertEquals(0.4, features.getConstraints().getUpsideAsymmetry(), EPSILON);
    }

    @Test
    void shouldClassifyDecisionTypes() {
        assertEquals(SituationFeatures.DecisionType.REVERSIBLE,
                extractor.decisionType("i will try to negotiate and explore options"));
        assertEquals(SituationFeatures.DecisionType.EXPLORATORY, extractor.decisionType("maybe i should try it"));
        assertEquals(SituationFeatures.DecisionType.EXPLORATORY, extractor.decisionType("would a side project help"));
        assertEquals(SituationFeatures.DecisionType.IRREVERSIBLE, extractor.decisionType("we might divorce"));
    }

    @Test
    void shouldDetectHorizonAndCommitment() {
        DecisionFeatures longTerm = extractor.extract("Should I sign the mortgage for the next decade?", null, null);
        DecisionFeatures shortTerm = extractor.extract("Only for tonight", null, null);

        assertEquals(SituationFeatures.TimeHorizon.LONG, longTerm.getSituation().getTimeHorizon());
        assertEquals(0.7, longTerm.getConstraints().getOptionalityLossScore(), EPSILON);
        assertEquals(SituationFeatures.TimeHorizon.SHORT, shortTerm.getSituation().getTimeHorizon());
        assertEquals(0.0, shortTerm.getConstraints().getOptionalityLossScore(), EPSILON);
    }

    @Test
    void shouldUseNeutralDefaultsWithoutAnalysis() {
        DecisionFeatures features = extractor.extract("would a side project help", null, null);

        assertEquals(Level.LOW, features.getSituation().getRiskLevel());
        assertEquals(0.2, features.getSituation().getTimePressure(), EPSILON);
        assertEquals(0.5, features.getSituation().getInformationCompleteness(), EPSILON);
        assertEquals(0.3, features.getConstraints().getDownsideAsymmetry(), EPSILON);
        assertTrue(features.getKnowledge().getUsedTypes().isEmpty());
    }

    @Test
    void shouldCarryKnowledgeUsage() {
        KnowledgeUsage usage = KnowledgeUsage.builder()
                .usedTypes(new LinkedHashSet<>(Set.of(KnowledgeType.WARNING)))
                .entryIds(new ArrayList<>(List.of("k-1")))
                .build();

        DecisionFeatures features = extractor.extract("would a side project help", new SituationAnalysis(),
                KnowledgeSynthesis.builder().usage(usage).build());

        assertEquals(List.of("k-1"), features.getKnowledge().getEntryIds());
        assertTrue(features.getKnowledge().uses(KnowledgeType.WARNING));
    }
}
