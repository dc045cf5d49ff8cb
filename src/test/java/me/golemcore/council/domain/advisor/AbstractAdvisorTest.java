package me.golemcore.council.domain.advisor;

import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.Doctrine;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Stance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AbstractAdvisorTest {

    private KnowledgeScoringService knowledgeScoring;
    private DoctrineCatalog doctrines;

    @BeforeEach
    void setUp() {
        knowledgeScoring = mock(KnowledgeScoringService.class);
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(KnowledgeSynthesis.builder().build());
        doctrines = DoctrineCatalog.of(Map.of("risk", Doctrine.builder()
                .name("risk")
                .roleType("minister")
                .worldviewPhrase("protect the downside")
                .worldviewPhrase("survive first")
                .worldviewPhrase("never risk ruin")
                .prohibition("bet everything")
                .build()));
    }

    @Test
    void shouldTreatDoctrineProhibitionAsRedLine() {
        Position position = new RiskAdvisor(doctrines, knowledgeScoring)
                .analyze("I want to Bet Everything on one stock", new DecisionContext());

        assertTrue(position.isRedLineTriggered());
        assertTrue(position.isDoctrineApplied());
        assertEquals(Stance.OPPOSE, position.getStance());
        assertEquals(0.95, position.getConfidence());
        assertEquals(List.of("prohibition_violation"), position.getConcerns());
    }

    @Test
    void shouldSupportOnStrongWorldviewMatch() {
        Position position = new RiskAdvisor(doctrines, knowledgeScoring)
                .analyze("My plan is to protect the downside and survive first", new DecisionContext());

        assertEquals(Stance.SUPPORT, position.getStance());
        assertTrue(position.isDoctrineApplied());
        assertEquals(0.5 + 0.45 * (2.0 / 3.0), position.getConfidence(), 1e-9);
    }

    @Test
    void shouldStayNeutralOnWeakWorldviewMatch() {
        Map<String, Doctrine> wide = Map.of("risk", Doctrine.builder()
                .name("risk")
                .worldview(List.of("protect the downside", "survive first", "never risk ruin", "keep a margin"))
                .build());

        Position position = new RiskAdvisor(DoctrineCatalog.of(wide), knowledgeScoring)
                .analyze("I will protect the downside", new DecisionContext());

        assertEquals(Stance.NEUTRAL, position.getStance());
        assertEquals(0.5 + 0.45 * 0.25, position.getConfidence(), 1e-9);
    }

    @Test
    void shouldFallBackToSeatHeuristicWithoutDoctrineMatch() {
        Position position = new RiskAdvisor(doctrines, knowledgeScoring)
                .analyze("I would like to learn the piano", new DecisionContext());

        assertFalse(position.isDoctrineApplied());
        assertEquals(Stance.SUPPORT, position.getStance());
        assertEquals(AdvisorId.RISK, position.getAdvisor());
    }
}
