package me.golemcore.council.domain.council;

import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.CouncilRecommendation;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Stance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CouncilAggregatorTest {

    private static final double EPSILON = 1e-9;

    private CouncilAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new CouncilAggregator();
    }

    @Test
    void shouldReachSupportConsensusWithQuorum() {
        Map<AdvisorId, Position> positions = new LinkedHashMap<>();
        List<AdvisorId> seats = AdvisorId.voting();
        for (int i = 0; i < seats.size(); i++) {
            Stance stance = i < 12 ? Stance.SUPPORT : i < 16 ? Stance.OPPOSE : Stance.NEUTRAL;
            positions.put(seats.get(i), position(seats.get(i), stance, 0.7, false));
        }

        CouncilRecommendation recommendation = aggregator.aggregate(positions);

        assertEquals(CouncilRecommendation.Outcome.CONSENSUS_REACHED, recommendation.getOutcome());
        assertEquals(CouncilRecommendation.Recommendation.SUPPORT, recommendation.getRecommendation());
        assertEquals(12.0 / 19.0, recommendation.getConsensusStrength(), EPSILON);
        assertEquals(12, recommendation.getSupportVotes());
        assertEquals(4, recommendation.getOpposeVotes());
        assertEquals(3, recommendation.getNeutralVotes());
        assertEquals(19, recommendation.totalVotes());
        assertEquals(4, recommendation.getDissenters().size());
        assertEquals(0.7, recommendation.getAvgConfidence(), EPSILON);
    }

    @Test
    void shouldLetRedLineOverrideSupportingMajority() {
        Map<AdvisorId, Position> positions = new LinkedHashMap<>();
        positions.put(AdvisorId.POWER, position(AdvisorId.POWER, Stance.SUPPORT, 0.8, false));
        positions.put(AdvisorId.TIMING, position(AdvisorId.TIMING, Stance.SUPPORT, 0.8, false));
        positions.put(AdvisorId.DATA, position(AdvisorId.DATA, Stance.SUPPORT, 0.8, false));
        positions.put(AdvisorId.RISK, position(AdvisorId.RISK, Stance.OPPOSE, 0.95, true));

        CouncilRecommendation recommendation = aggregator.aggregate(positions);

        assertEquals(CouncilRecommendation.Outcome.CONSENSUS_REACHED, recommendation.getOutcome());
        assertEquals(CouncilRecommendation.Recommendation.OPPOSE, recommendation.getRecommendation());
        assertEquals(0.95, recommendation.getConsensusStrength(), EPSILON);
        assertEquals(List.of("risk: risk reasoning"), recommendation.getRedLineConcerns());
        assertEquals(List.of(AdvisorId.POWER, AdvisorId.TIMING, AdvisorId.DATA), recommendation.getDissenters());
    }

    @Test
    void shouldReachOpposeConsensusWithQuorum() {
        Map<AdvisorId, Position> positions = new LinkedHashMap<>();
        positions.put(AdvisorId.RISK, position(AdvisorId.RISK, Stance.OPPOSE, 0.6, false));
        positions.put(AdvisorId.DATA, position(AdvisorId.DATA, Stance.OPPOSE, 0.6, false));
        positions.put(AdvisorId.TRUTH, position(AdvisorId.TRUTH, Stance.OPPOSE, 0.6, false));
        positions.put(AdvisorId.POWER, position(AdvisorId.POWER, Stance.SUPPORT, 0.6, false));

        CouncilRecommendation recommendation = aggregator.aggregate(positions);

        assertEquals(CouncilRecommendation.Outcome.CONSENSUS_REACHED, recommendation.getOutcome());
        assertEquals(CouncilRecommendation.Recommendation.OPPOSE, recommendation.getRecommendation());
        assertEquals(0.75, recommendation.getConsensusStrength(), EPSILON);
        assertEquals(List.of(AdvisorId.POWER), recommendation.getDissenters());
        assertTrue(recommendation.getRedLineConcerns().isEmpty());
    }

    @Test
    void shouldReportBoundedTradeoffForSplitCouncil() {
        Map<AdvisorId, Position> positions = new LinkedHashMap<>();
        positions.put(AdvisorId.POWER, position(AdvisorId.POWER, Stance.SUPPORT, 0.6, false));
        positions.put(AdvisorId.TIMING, position(AdvisorId.TIMING, Stance.SUPPORT, 0.6, false));
        positions.put(AdvisorId.RISK, position(AdvisorId.RISK, Stance.OPPOSE, 0.6, false));
        positions.put(AdvisorId.DATA, position(AdvisorId.DATA, Stance.NEUTRAL, 0.6, false));
        positions.put(AdvisorId.TRUTH, position(AdvisorId.TRUTH, Stance.NEUTRAL, 0.6, false));

        CouncilRecommendation recommendation = aggregator.aggregate(positions);

        assertEquals(CouncilRecommendation.Outcome.BOUNDED_RISK_TRADEOFF, recommendation.getOutcome());
        assertEquals(CouncilRecommendation.Recommendation.SUPPORT_WITH_CAUTION, recommendation.getRecommendation());
        assertEquals(0.4, recommendation.getConsensusStrength(), EPSILON);
        assertEquals(List.of(AdvisorId.RISK), recommendation.getDissenters());
    }

    @Test
    void shouldDeadlockWhenEveryoneIsNeutral() {
        Map<AdvisorId, Position> positions = new LinkedHashMap<>();
        positions.put(AdvisorId.POWER, position(AdvisorId.POWER, Stance.NEUTRAL, 0.5, false));
        positions.put(AdvisorId.TIMING, position(AdvisorId.TIMING, Stance.NEUTRAL, 0.5, false));

        CouncilRecommendation recommendation = aggregator.aggregate(positions);

        assertEquals(CouncilRecommendation.Outcome.DEADLOCKED, recommendation.getOutcome());
        assertEquals(CouncilRecommendation.Recommendation.DEFER, recommendation.getRecommendation());
        assertEquals(0.0, recommendation.getConsensusStrength(), EPSILON);
        assertEquals("No majority emerged", recommendation.getReasoning());
    }

    @Test
    void shouldDeadlockWithDefaultConfidenceWhenNobodyVoted() {
        CouncilRecommendation recommendation = aggregator.aggregate(Map.of());

        assertEquals(CouncilRecommendation.Outcome.DEADLOCKED, recommendation.getOutcome());
        assertEquals(0.5, recommendation.getAvgConfidence(), EPSILON);
        assertEquals(0, recommendation.totalVotes());
        assertEquals("No advisor responded", recommendation.getReasoning());
    }

    private static Position position(AdvisorId advisor, Stance stance, double confidence, boolean redLine) {
        return Position.builder()
                .advisor(advisor)
                .stance(stance)
                .confidence(confidence)
                .redLineTriggered(redLine)
                .reasoning(advisor.key() + " reasoning")
                .build();
    }
}
