package me.golemcore.council.domain.learning;

import me.golemcore.council.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.council.domain.model.ConstraintFeatures;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.KnowledgeType;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.PriorPrediction;
import me.golemcore.council.domain.model.SituationFeatures;
import me.golemcore.council.domain.model.TrainingSample;
import me.golemcore.council.domain.model.TypeWeights;
import me.golemcore.council.infrastructure.config.AutoConfiguration;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JudgmentPriorServiceTest {

    private static final double EPSILON = 1e-9;

    @TempDir
    Path tempDir;

    private CouncilProperties properties;
    private LocalStorageAdapter storage;
    private JudgmentPriorService priorService;

    @BeforeEach
    void setUp() {
        properties = new CouncilProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        priorService = new JudgmentPriorService(storage, properties, AutoConfiguration.objectMapper());
    }

    @Test
    void shouldHashSituationIntoBucket() {
        assertEquals("irreversible_high_h", JudgmentPriorService.computeSituationHash(
                features(SituationFeatures.DecisionType.IRREVERSIBLE, Level.HIGH, 0.85)));
        assertEquals("reversible_low_l", JudgmentPriorService.computeSituationHash(
                features(SituationFeatures.DecisionType.REVERSIBLE, Level.LOW, 0.7)));
        assertEquals("exploratory_low_l", JudgmentPriorService.computeSituationHash(null));
    }

    @Test
    void shouldGrowConfidenceLogarithmicallyUpToCap() {
        assertEquals(0.5, JudgmentPriorService.confidenceFor(0), EPSILON);
        assertEquals(0.5 + 0.1 * Math.log(6.0), JudgmentPriorService.confidenceFor(5), EPSILON);
        assertEquals(0.95, JudgmentPriorService.confidenceFor(1_000_000), EPSILON);
    }

    @Test
    void shouldPredictNeutralForUnknownBucket() {
        PriorPrediction prediction = priorService.predict(
                features(SituationFeatures.DecisionType.IRREVERSIBLE, Level.HIGH, 0.9));

        assertEquals(TypeWeights.neutral(), prediction.getWeights());
        assertEquals(0.3, prediction.getConfidence(), EPSILON);
        assertEquals(0, prediction.getSampleCount());
    }

    @Test
    void shouldNotTrainBelowMinimumSamplesUnlessForced() {
        List<TrainingSample> samples = samples(2, new TypeWeights(1.2, 1.0, 1.2, 1.0, 0.8));

        assertFalse(priorService.train(samples, false));
        assertTrue(priorService.buckets().isEmpty());

        assertTrue(priorService.train(samples, true));
        assertEquals(2, priorService.buckets().get("irreversible_high_h").getSampleCount());
    }

    @Test
    void shouldAverageSamplesAndPersistPrior() {
        List<TrainingSample> samples = new ArrayList<>(samples(3, new TypeWeights(1.2, 1.0, 1.3, 1.0, 0.8)));
        samples.addAll(samples(3, new TypeWeights(1.0, 1.0, 1.1, 1.0, 1.0)));

        assertTrue(priorService.train(samples, false));

        JudgmentPriorService reloaded = new JudgmentPriorService(storage, properties,
                AutoConfiguration.objectMapper());
        PriorPrediction prediction = reloaded.predict(
                features(SituationFeatures.DecisionType.IRREVERSIBLE, Level.HIGH, 0.9));
        assertEquals(6, prediction.getSampleCount());
        assertEquals(1.2, prediction.getWeights().get(KnowledgeType.WARNING), EPSILON);
        assertEquals(0.9, prediction.getWeights().get(KnowledgeType.ADVICE), EPSILON);
        assertEquals(JudgmentPriorService.confidenceFor(6), prediction.getConfidence(), EPSILON);
    }

    @Test
    void shouldApplyBiasOnlyAboveConfidenceThreshold() {
        assertTrue(priorService.train(samples(5, new TypeWeights(1.0, 1.0, 1.2, 1.0, 0.8)), false));
        DecisionFeatures features = features(SituationFeatures.DecisionType.IRREVERSIBLE, Level.HIGH, 0.9);
        Map<KnowledgeType, Double> scores = new EnumMap<>(KnowledgeType.class);
        scores.put(KnowledgeType.WARNING, 0.5);
        scores.put(KnowledgeType.ADVICE, 0.5);

        Map<KnowledgeType, Double> biased = priorService.applyBias(scores, features, 0.6);
        Map<KnowledgeType, Double> untouched = priorService.applyBias(scores, features, 0.9);

        assertEquals(0.6, biased.get(KnowledgeType.WARNING), EPSILON);
        assertEquals(0.4, biased.get(KnowledgeType.ADVICE), EPSILON);
        assertEquals(0.5, untouched.get(KnowledgeType.WARNING), EPSILON);
    }

    @Test
    void shouldPredictNeutralWhenLearningDisabled() {
        assertTrue(priorService.train(samples(5, new TypeWeights(1.3, 1.3, 1.3, 1.3, 1.3)), false));
        properties.getLearning().setEnabled(false);

        PriorPrediction prediction = priorService.predict(
                features(SituationFeatures.DecisionType.IRREVERSIBLE, Level.HIGH, 0.9));

        assertEquals(TypeWeights.neutral(), prediction.getWeights());
        assertEquals(0.0, prediction.getConfidence(), EPSILON);
    }

    @Test
    void shouldResetLearnedPrior() {
        assertTrue(priorService.train(samples(5, new TypeWeights(1.3, 1.3, 1.3, 1.3, 1.3)), false));

        assertTrue(priorService.reset());

        assertTrue(priorService.buckets().isEmpty());
        JudgmentPriorService reloaded = new JudgmentPriorService(storage, properties,
                AutoConfiguration.objectMapper());
        assertTrue(reloaded.buckets().isEmpty());
    }

    @Test
    void shouldStartEmptyWhenPriorFileIsCorrupt() {
        storage.putText("learning", "judgment-prior.json", "{not json").join();

        assertTrue(priorService.buckets().isEmpty());
    }

    private static List<TrainingSample> samples(int count, TypeWeights label) {
        List<TrainingSample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(TrainingSample.builder()
                    .decisionKey("d-" + i)
                    .features(features(SituationFeatures.DecisionType.IRREVERSIBLE, Level.HIGH, 0.9))
                    .label(label)
                    .build());
        }
        return samples;
    }

    private static DecisionFeatures features(SituationFeatures.DecisionType type, Level risk,
            double irreversibility) {
        return DecisionFeatures.builder()
                .situation(SituationFeatures.builder().decisionType(type).riskLevel(risk).build())
                .constraints(ConstraintFeatures.builder().irreversibilityScore(irreversibility).build())
                .build();
    }
}
