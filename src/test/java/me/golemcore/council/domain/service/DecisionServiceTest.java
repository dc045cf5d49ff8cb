package me.golemcore.council.domain.service;

import me.golemcore.council.domain.advisor.DoctrineCatalog;
import me.golemcore.council.domain.analysis.ClarificationService;
import me.golemcore.council.domain.analysis.FeatureExtractor;
import me.golemcore.council.domain.analysis.SituationAnalysisService;
import me.golemcore.council.domain.analysis.SituationHeuristics;
import me.golemcore.council.domain.authority.FinalAuthorityGate;
import me.golemcore.council.domain.council.CouncilAggregator;
import me.golemcore.council.domain.council.CouncilService;
import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.learning.DecisionLedgerService;
import me.golemcore.council.domain.mode.DarbarModeStrategy;
import me.golemcore.council.domain.mode.MeetingModeStrategy;
import me.golemcore.council.domain.mode.ModeRouter;
import me.golemcore.council.domain.mode.QuickModeStrategy;
import me.golemcore.council.domain.mode.WarModeStrategy;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.AuthorityVerdict;
import me.golemcore.council.domain.model.CouncilSession;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.DecisionMode;
import me.golemcore.council.domain.model.DecisionRecord;
import me.golemcore.council.domain.model.DecisionRequest;
import me.golemcore.council.domain.model.DecisionResult;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.ModeInterpretation;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.domain.model.Stance;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionServiceTest {

    private static final String KEY = "dec_1700000000000_0a1b2c3d";

    private SituationAnalysisService analysisService;
    private KnowledgeScoringService knowledgeScoring;
    private CouncilService councilService;
    private DecisionLedgerService decisionLedger;
    private ModeRouter modeRouter;
    private DecisionService decisionService;

    @BeforeEach
    void setUp() {
        CouncilProperties properties = new CouncilProperties();
        SituationHeuristics heuristics = new SituationHeuristics();
        analysisService = mock(SituationAnalysisService.class);
        knowledgeScoring = mock(KnowledgeScoringService.class);
        councilService = mock(CouncilService.class);
        decisionLedger = mock(DecisionLedgerService.class);
        modeRouter = new ModeRouter(List.of(new QuickModeStrategy(), new WarModeStrategy(),
                new MeetingModeStrategy(), new DarbarModeStrategy()), properties);

        when(analysisService.analyze(anyString())).thenAnswer(invocation -> heuristics
                .analyze(invocation.getArgument(0)));
        when(analysisService.analyzeInContext(anyString(), anyString())).thenAnswer(invocation -> heuristics
                .analyze(invocation.getArgument(1)));
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class)))
                .thenReturn(KnowledgeSynthesis.builder().candidateQuality(0.8).build());
        when(decisionLedger.newDecisionKey(anyString())).thenReturn(KEY);
        when(decisionLedger.recordDecision(any(DecisionRecord.class))).thenReturn(true);

        decisionService = new DecisionService(analysisService, modeRouter,
                new ClarificationService(knowledgeScoring, heuristics, properties), new FeatureExtractor(),
                councilService, new FinalAuthorityGate(DoctrineCatalog.empty(), properties), decisionLedger);
    }

    @Test
    void shouldConveneCouncilAndGateRecommendation() {
        when(councilService.convene(anyList(), anyString(), any(DecisionContext.class)))
                .thenAnswer(invocation -> session(invocation.getArgument(0), Stance.SUPPORT));

        DecisionResult result = decisionService.decide(DecisionRequest.builder()
                .input("Should I quit my job and join a startup?")
                .build());

        assertEquals(KEY, result.getDecisionKey());
        assertEquals(DecisionMode.MEETING, result.getMode());
        assertTrue(result.getAdvisorsInvolved().contains(AdvisorId.RISK));
        assertEquals(ModeInterpretation.STRONG_CONSENSUS_SUPPORT, result.getInterpretation());
        assertEquals(AuthorityVerdict.FinalOutcome.ACCEPT, result.getVerdict().getFinalOutcome());
        assertTrue(result.isRecorded());
        assertNull(result.getClarifyingQuestion());
        assertNotNull(result.getFeatures());

        ArgumentCaptor<DecisionRecord> record = ArgumentCaptor.forClass(DecisionRecord.class);
        verify(decisionLedger).recordDecision(record.capture());
        assertEquals(KEY, record.getValue().getDecisionKey());
        assertEquals(result.getAdvisorsInvolved().size(), record.getValue().getPositions().size());
        assertEquals(AuthorityVerdict.FinalOutcome.ACCEPT, record.getValue().getVerdict().getFinalOutcome());
    }

    @Test
    void shouldSkipCouncilInQuickMode() {
        DecisionResult result = decisionService.decide(DecisionRequest.builder()
                .input("Should I quit my job?")
                .mode(DecisionMode.QUICK)
                .build());

        assertEquals(DecisionMode.QUICK, result.getMode());
        assertEquals(ModeInterpretation.DIRECT_RESPONSE, result.getInterpretation());
        assertNull(result.getRecommendation());
        assertNull(result.getVerdict());
        assertTrue(result.getAdvisorsInvolved().isEmpty());
        verify(councilService, never()).convene(anyList(), anyString(), any(DecisionContext.class));
        verify(decisionLedger).recordDecision(any(DecisionRecord.class));
    }

    @Test
    void shouldUseRouterModeWhenRequestHasNone() {
        modeRouter.setMode(DecisionMode.WAR);
        when(councilService.convene(anyList(), anyString(), any(DecisionContext.class)))
                .thenAnswer(invocation -> session(invocation.getArgument(0), Stance.OPPOSE));

        DecisionResult result = decisionService.decide(DecisionRequest.builder()
                .input("Launch the product tonight?")
                .build());

        assertEquals(DecisionMode.WAR, result.getMode());
        assertEquals(5, result.getAdvisorsInvolved().size());
        assertEquals(ModeInterpretation.DEFENSIVE_HOLD_OR_PIVOT, result.getInterpretation());
    }

    @Test
    void shouldReturnClarifyingQuestionWhenKnowledgeIsWeak() {
        when(knowledgeScoring.synthesize(any(KnowledgeQuery.class)))
                .thenReturn(KnowledgeSynthesis.builder().candidateQuality(0.1).build());

        DecisionResult result = decisionService.decide(DecisionRequest.builder()
                .input("Should I quit my job?")
                .mode(DecisionMode.QUICK)
                .build());

        assertNotNull(result.getClarifyingQuestion());
    }

    @Test
    void shouldAnalyzeInConversationAndScheduleSnapshot() {
        DecisionResult result = decisionService.decide(DecisionRequest.builder()
                .input("and what about my savings?")
                .mode(DecisionMode.QUICK)
                .conversationId("conv-1")
                .recentTurns(List.of("Should I quit my job?"))
                .build());

        assertEquals(SituationAnalysis.Source.HEURISTIC, result.getAnalysis().getSource());
        verify(analysisService).analyzeInContext("conv-1", "and what about my savings?");
        verify(analysisService).analyzeInBackground(eq("conv-1"),
                eq("Should I quit my job?\nand what about my savings?"));
        verify(analysisService, never()).analyze(anyString());
    }

    @Test
    void shouldRejectBlankInput() {
        assertThrows(IllegalArgumentException.class,
                () -> decisionService.decide(DecisionRequest.builder().input("  ").build()));
        assertThrows(IllegalArgumentException.class, () -> decisionService.decide(null));
    }

    private static CouncilSession session(List<AdvisorId> advisors, Stance stance) {
        Map<AdvisorId, Position> positions = new LinkedHashMap<>();
        for (AdvisorId advisor : advisors) {
            positions.put(advisor, Position.builder()
                    .advisor(advisor)
                    .stance(stance)
                    .confidence(0.8)
                    .reasoning(advisor.key() + " weighed the options")
                    .build());
        }
        CouncilSession session = new CouncilSession();
        session.setPositions(positions);
        session.setRecommendation(new CouncilAggregator().aggregate(positions));
        return session;
    }
}
