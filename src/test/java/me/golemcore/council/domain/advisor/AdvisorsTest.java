package me.golemcore.council.domain.advisor;

import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.KnowledgeEntry;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.KnowledgeType;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.ScoredEntry;
import me.golemcore.council.domain.model.Stance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdvisorsTest {

    private KnowledgeScoringService knowledgeScoring;
    private DoctrineCatalog doctrines;

    @BeforeEach
    void setUp() {
        knowledgeScoring = mock(KnowledgeScoringService.class);
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(KnowledgeSynthesis.builder().build());
        doctrines = DoctrineCatalog.empty();
    }

    @Test
    void shouldDrawRedLineOnCriticalRisk() {
        Position position = new RiskAdvisor(doctrines, knowledgeScoring)
                .analyze("This could mean bankruptcy for the family", new DecisionContext());

        assertEquals(AdvisorId.RISK, position.getAdvisor());
        assertEquals(Stance.OPPOSE, position.getStance());
        assertEquals(0.95, position.getConfidence());
        assertTrue(position.isRedLineTriggered());
    }

    @Test
    void shouldOpposeOrdinaryRiskWithoutRedLine() {
        Position position = new RiskAdvisor(doctrines, knowledgeScoring)
                .analyze("There is a real danger of loss here", new DecisionContext());

        assertEquals(Stance.OPPOSE, position.getStance());
        assertEquals(0.75, position.getConfidence());
        assertFalse(position.isRedLineTriggered());
        assertEquals(List.of("downside_scenarios", "loss_prevention"), position.getConcerns());
    }

    @Test
    void shouldSupportWhenNoRiskLanguage() {
        Position position = new RiskAdvisor(doctrines, knowledgeScoring)
                .analyze("I would like to learn the piano", new DecisionContext());

        assertEquals(Stance.SUPPORT, position.getStance());
        assertEquals(0.5, position.getConfidence());
    }

    @Test
    void shouldNotTreatKnowAsHaste() {
        Position position = new TimingAdvisor(doctrines, knowledgeScoring)
                .analyze("I know what I want", new DecisionContext());

        assertEquals(Stance.NEUTRAL, position.getStance());
    }

    @Test
    void shouldOpposeHaste() {
        Position position = new TimingAdvisor(doctrines, knowledgeScoring)
                .analyze("I must sign immediately", new DecisionContext());

        assertEquals(Stance.OPPOSE, position.getStance());
        assertEquals(0.7, position.getConfidence());
    }

    @Test
    void shouldDrawRedLineOnDeception() {
        Position position = new TruthAdvisor(doctrines, knowledgeScoring)
                .analyze("I plan to hide the numbers from my partner", new DecisionContext());

        assertTrue(position.isRedLineTriggered());
        assertEquals(0.9, position.getConfidence());
    }

    @Test
    void shouldOpposeSpeculationWithoutRedLine() {
        Position position = new DataAdvisor(doctrines, knowledgeScoring)
                .analyze("I guess the market will probably grow", new DecisionContext());

        assertEquals(Stance.OPPOSE, position.getStance());
        assertFalse(position.isRedLineTriggered());
    }

    @Test
    void shouldDetectReversalAgainstLastTurn() {
        DecisionContext context = DecisionContext.builder()
                .recentTurns(new ArrayList<>(List.of("hello", "thinking about it", "maybe", "yes I will do it")))
                .build();

        Position position = new DisciplineAdvisor(doctrines, knowledgeScoring).analyze("no, I will not", context);

        assertEquals(Stance.OPPOSE, position.getStance());
        assertEquals(0.8, position.getConfidence());
    }

    @Test
    void shouldOpposeRepeatedHedging() {
        DecisionContext context = DecisionContext.builder()
                .recentTurns(new ArrayList<>(List.of("I want it but", "however it is hard", "but also fun")))
                .build();

        Position position = new NarrativeAdvisor(doctrines, knowledgeScoring).analyze("what now", context);

        assertEquals(Stance.OPPOSE, position.getStance());
    }

    @Test
    void shouldFlagCommitmentWithoutExit() {
        Position position = new OptionalityAdvisor(doctrines, knowledgeScoring)
                .analyze("I am going all in on this forever", new DecisionContext());

        assertEquals(Stance.OPPOSE, position.getStance());
        assertEquals(List.of("irreversibility", "exit_collapse"), position.getConcerns());
    }

    @Test
    void shouldDrawTribunalRedLineOnlyWithoutAccountability() {
        TribunalAdvisor tribunal = new TribunalAdvisor(doctrines, knowledgeScoring);

        Position evasive = tribunal.analyze("Someone else did it and I deny everything", new DecisionContext());
        Position mixed = tribunal.analyze("It was not my fault but I accept the consequences",
                new DecisionContext());

        assertTrue(evasive.isRedLineTriggered());
        assertFalse(mixed.isRedLineTriggered());
        assertEquals(Stance.OPPOSE, mixed.getStance());
    }

    @Test
    void shouldSupportAdaptationWhenKnowledgeFound() {
        KnowledgeEntry entry = KnowledgeEntry.builder().id("k-9").domain("adaptation").type(KnowledgeType.ADVICE)
                .content("Change before you must.").build();
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(KnowledgeSynthesis.builder()
                .entries(new ArrayList<>(List.of(new ScoredEntry(entry, 1.2))))
                .build());

        Position position = new AdaptationAdvisor(doctrines, knowledgeScoring)
                .analyze("Things are not working anymore", new DecisionContext());

        assertEquals(Stance.SUPPORT, position.getStance());
        assertEquals(List.of("k-9"), position.getKnowledgeIds());
    }

    @Test
    void shouldConsultKnowledgeUnderOwnDomainAndPosture() {
        new PowerAdvisor(doctrines, knowledgeScoring).analyze("Who has leverage here?", new DecisionContext());

        ArgumentCaptor<KnowledgeQuery> query = ArgumentCaptor.forClass(KnowledgeQuery.class);
        verify(knowledgeScoring).synthesize(query.capture());
        assertEquals(List.of("power"), query.getValue().getActiveDomains());
        assertEquals(Integer.valueOf(3), query.getValue().getMaxItems());
    }

    @Test
    void shouldStayNeutralWhenKnowledgeLookupFails() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenThrow(new IllegalStateException("down"));

        Position position = new AdaptationAdvisor(doctrines, knowledgeScoring)
                .analyze("Should I change course?", new DecisionContext());

        assertEquals(Stance.NEUTRAL, position.getStance());
        assertTrue(position.getKnowledgeIds().isEmpty());
    }
}
