package me.golemcore.council.domain.analysis;

import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.SituationFrame;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClarificationLoopTest {

    private KnowledgeScoringService knowledgeScoring;
    private ClarificationService clarificationService;

    @BeforeEach
    void setUp() {
        knowledgeScoring = mock(KnowledgeScoringService.class);
        CouncilProperties properties = new CouncilProperties();
        properties.getClarification().setMaxRounds(2);
        properties.getClarification().setQualityThreshold(0.5);
        clarificationService = new ClarificationService(knowledgeScoring, new SituationHeuristics(), properties);
    }

    @Test
    void shouldBeSatisfiedImmediatelyWhenKnowledgeIsGoodEnough() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(synthesis(0.7));

        ClarificationLoop loop = clarificationService.start(query(List.of("career"), 0.7));

        assertEquals(ClarificationLoop.State.SATISFIED, loop.getState());
        assertTrue(loop.isFinished());
        assertEquals(0, loop.getRound());
        assertThrows(IllegalStateException.class, loop::nextQuestion);
    }

    @Test
    void shouldAskForDomainFirstAndUseAnswerToClassify() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(synthesis(0.2), synthesis(0.6));

        ClarificationLoop loop = clarificationService.start(query(List.of(), 0.7));

        assertEquals(ClarificationLoop.State.ASKING, loop.getState());
        assertEquals(ClarificationLoop.DOMAIN_QUESTION, loop.nextQuestion());
        assertEquals(ClarificationLoop.State.AWAITING_ANSWER, loop.getState());

        assertEquals(ClarificationLoop.State.SATISFIED, loop.answer("Mostly my job and my salary"));
        assertEquals(1, loop.getRound());
        assertEquals(List.of("career", "financial"), loop.getQuery().getActiveDomains());
        assertEquals(List.of("Mostly my job and my salary"), loop.getQuery().getExtraContext());
        assertEquals(0.6, loop.getSynthesis().getCandidateQuality());
    }

    @Test
    void shouldAskAboutOptionsWhenSituationIsUnclear() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(synthesis(0.1));

        ClarificationLoop loop = clarificationService.start(query(List.of("career"), 0.3));

        assertEquals(ClarificationLoop.CLARITY_QUESTION, loop.nextQuestion());
    }

    @Test
    void shouldStopAfterMaxRounds() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(synthesis(0.1));

        ClarificationLoop loop = clarificationService.start(query(List.of("career"), 0.7));
        assertEquals(ClarificationLoop.CONTEXT_QUESTION, loop.nextQuestion());
        assertEquals(ClarificationLoop.State.ASKING, loop.answer("no deadline"));
        loop.nextQuestion();
        assertEquals(ClarificationLoop.State.EXHAUSTED, loop.answer("savings of two months"));

        assertEquals(2, loop.getRound());
        assertTrue(loop.isFinished());
        assertThrows(IllegalStateException.class, () -> loop.answer("more"));

        ArgumentCaptor<KnowledgeQuery> queries = ArgumentCaptor.forClass(KnowledgeQuery.class);
        verify(knowledgeScoring, times(3)).synthesize(queries.capture());
        assertEquals(List.of("no deadline", "savings of two months"), queries.getValue().getExtraContext());
    }

    @Test
    void shouldRejectAnswerBeforeQuestion() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class))).thenReturn(synthesis(0.1));

        ClarificationLoop loop = clarificationService.start(query(List.of("career"), 0.7));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> loop.answer("early"));
        assertEquals("Cannot answer while ASKING", error.getMessage());
        assertFalse(loop.isFinished());
    }

    @Test
    void shouldRequireQuery() {
        assertThrows(IllegalArgumentException.class, () -> clarificationService.start(null));
    }

    private static KnowledgeQuery query(List<String> domains, double clarity) {
        return KnowledgeQuery.builder()
                .text("Should I take the offer?")
                .activeDomains(new ArrayList<>(domains))
                .frame(SituationFrame.builder().clarity(clarity).build())
                .build();
    }

    private static KnowledgeSynthesis synthesis(double quality) {
        return KnowledgeSynthesis.builder().candidateQuality(quality).build();
    }
}
