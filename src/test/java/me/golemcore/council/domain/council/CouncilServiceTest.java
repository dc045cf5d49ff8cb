package me.golemcore.council.domain.council;

import me.golemcore.council.domain.advisor.Advisor;
import me.golemcore.council.domain.advisor.AdvisorRegistry;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.CouncilRecommendation;
import me.golemcore.council.domain.model.CouncilSession;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.OmittedAdvisor;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Stance;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CouncilServiceTest {

    private ExecutorService executor;
    private CouncilProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new CouncilProperties();
        properties.getAdvisors().setTimeoutMs(2000);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldCollectVotingPositionsAndAggregate() {
        CouncilService service = service(List.of(
                advisor(AdvisorId.RISK, Stance.SUPPORT),
                advisor(AdvisorId.POWER, Stance.SUPPORT),
                advisor(AdvisorId.TIMING, Stance.OPPOSE)));

        CouncilSession session = service.convene(List.of(AdvisorId.RISK, AdvisorId.POWER, AdvisorId.TIMING),
                "should I take the job", new DecisionContext());

        assertEquals(List.of(AdvisorId.RISK, AdvisorId.POWER, AdvisorId.TIMING),
                List.copyOf(session.getPositions().keySet()));
        assertTrue(session.getOmitted().isEmpty());
        assertEquals(CouncilRecommendation.Outcome.CONSENSUS_REACHED, session.getRecommendation().getOutcome());
        assertEquals(2, session.getRecommendation().getSupportVotes());
    }

    @Test
    void shouldKeepJudgeOutOfTheVote() {
        CouncilService service = service(List.of(
                advisor(AdvisorId.RISK, Stance.SUPPORT),
                advisor(AdvisorId.TRIBUNAL, Stance.OPPOSE)));

        CouncilSession session = service.convene(List.of(AdvisorId.RISK, AdvisorId.TRIBUNAL), "input",
                new DecisionContext());

        assertTrue(session.getJudgeObservations().containsKey(AdvisorId.TRIBUNAL));
        assertFalse(session.getPositions().containsKey(AdvisorId.TRIBUNAL));
        assertEquals(1, session.getRecommendation().totalVotes());
    }

    @Test
    void shouldOmitFailingAdvisor() {
        Advisor failing = mock(Advisor.class);
        when(failing.id()).thenReturn(AdvisorId.DATA);
        when(failing.analyze(anyString(), any(DecisionContext.class)))
                .thenThrow(new IllegalStateException("boom"));
        CouncilService service = service(List.of(advisor(AdvisorId.RISK, Stance.SUPPORT), failing));

        CouncilSession session = service.convene(List.of(AdvisorId.RISK, AdvisorId.DATA), "input",
                new DecisionContext());

        assertEquals(1, session.getPositions().size());
        assertEquals(1, session.getOmitted().size());
        OmittedAdvisor omitted = session.getOmitted().get(0);
        assertEquals(AdvisorId.DATA, omitted.getAdvisor());
        assertEquals(OmittedAdvisor.Reason.FAILED, omitted.getReason());
        assertEquals("boom", omitted.getDetail());
    }

    @Test
    void shouldOmitAdvisorThatMissesTheDeadline() {
        properties.getAdvisors().setTimeoutMs(50);
        Advisor slow = mock(Advisor.class);
        when(slow.id()).thenReturn(AdvisorId.TIMING);
        when(slow.analyze(anyString(), any(DecisionContext.class))).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return Position.builder().advisor(AdvisorId.TIMING).build();
        });
        CouncilService service = service(List.of(advisor(AdvisorId.RISK, Stance.SUPPORT), slow));

        CouncilSession session = service.convene(List.of(AdvisorId.RISK, AdvisorId.TIMING), "input",
                new DecisionContext());

        assertFalse(session.getPositions().containsKey(AdvisorId.TIMING));
        assertTrue(session.getOmitted().stream()
                .anyMatch(omitted -> omitted.getAdvisor() == AdvisorId.TIMING
                        && omitted.getReason() == OmittedAdvisor.Reason.TIMED_OUT));
    }

    @Test
    void shouldOmitUnregisteredAdvisor() {
        CouncilService service = service(List.of(advisor(AdvisorId.RISK, Stance.OPPOSE)));

        CouncilSession session = service.convene(List.of(AdvisorId.RISK, AdvisorId.SOVEREIGN), "input",
                new DecisionContext());

        assertEquals(1, session.getPositions().size());
        assertEquals(OmittedAdvisor.Reason.NOT_REGISTERED, session.getOmitted().get(0).getReason());
        assertEquals(AdvisorId.SOVEREIGN, session.getOmitted().get(0).getAdvisor());
    }

    @Test
    void shouldDeadlockWhenNoAdvisorSits() {
        CouncilService service = service(List.of());

        CouncilSession session = service.convene(List.of(), "input", new DecisionContext());

        assertEquals(CouncilRecommendation.Outcome.DEADLOCKED, session.getRecommendation().getOutcome());
    }

    private CouncilService service(List<Advisor> advisors) {
        return new CouncilService(new AdvisorRegistry(advisors), new CouncilAggregator(), executor, properties);
    }

    private static Advisor advisor(AdvisorId id, Stance stance) {
        Advisor advisor = mock(Advisor.class);
        when(advisor.id()).thenReturn(id);
        when(advisor.analyze(anyString(), any(DecisionContext.class))).thenReturn(Position.builder()
                .advisor(id)
                .stance(stance)
                .confidence(0.7)
                .reasoning(id.key() + " says " + stance)
                .build());
        return advisor;
    }
}
