package me.golemcore.council.adapter.inbound.web.controller;

import me.golemcore.council.domain.learning.DecisionLedgerService;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.DoctrineEffectiveness;
import me.golemcore.council.domain.model.OutcomeRecord;
import me.golemcore.council.domain.model.OutcomeStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OutcomeControllerTest {

    private DecisionLedgerService decisionLedger;
    private OutcomeController controller;

    @BeforeEach
    void setUp() {
        decisionLedger = mock(DecisionLedgerService.class);
        controller = new OutcomeController(decisionLedger);
    }

    @Test
    void recordOutcomeShouldMapRequest() {
        when(decisionLedger.recordOutcome(any(OutcomeRecord.class))).thenReturn(true);

        StepVerifier.create(controller.recordOutcome("dec_1_0a1b2c3d",
                new OutcomeController.OutcomeRequest(false, 0.7, 30.0, true)))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertTrue(resp.getBody().recorded());
                })
                .verifyComplete();

        ArgumentCaptor<OutcomeRecord> captor = ArgumentCaptor.forClass(OutcomeRecord.class);
        verify(decisionLedger).recordOutcome(captor.capture());
        assertEquals("dec_1_0a1b2c3d", captor.getValue().getDecisionKey());
        assertFalse(captor.getValue().isSuccess());
        assertEquals(0.7, captor.getValue().getRegretScore());
        assertEquals(30.0, captor.getValue().getRecoveryTimeDays());
        assertTrue(captor.getValue().isSecondaryDamage());
    }

    @Test
    void recordOutcomeShouldReportRejection() {
        when(decisionLedger.recordOutcome(any(OutcomeRecord.class))).thenReturn(false);

        StepVerifier.create(controller.recordOutcome("dec_1_0a1b2c3d",
                new OutcomeController.OutcomeRequest(true, null, null, null)))
                .assertNext(resp -> assertFalse(resp.getBody().recorded()))
                .verifyComplete();
    }

    @Test
    void recordOutcomeShouldRequireSuccessFlag() {
        StepVerifier.create(controller.recordOutcome("dec_1_0a1b2c3d",
                new OutcomeController.OutcomeRequest(null, 0.1, 1.0, false)))
                .expectErrorSatisfies(error -> assertEquals(HttpStatus.BAD_REQUEST,
                        ((ResponseStatusException) error).getStatusCode()))
                .verify();
        verify(decisionLedger, never()).recordOutcome(any(OutcomeRecord.class));
    }

    @Test
    void statisticsShouldReturnLedgerStatistics() {
        when(decisionLedger.statistics()).thenReturn(OutcomeStatistics.builder()
                .totalDecisions(4)
                .withOutcome(2)
                .successRate(0.5)
                .doctrineEffectiveness(List.of(DoctrineEffectiveness.builder()
                        .advisor(AdvisorId.RISK)
                        .successes(1)
                        .failures(1)
                        .totalUses(2)
                        .successRate(0.5)
                        .build()))
                .build());

        StepVerifier.create(controller.statistics())
                .assertNext(resp -> {
                    assertEquals(4, resp.getBody().getTotalDecisions());
                    assertEquals(0.5, resp.getBody().getSuccessRate());
                    assertEquals(AdvisorId.RISK, resp.getBody().getDoctrineEffectiveness().get(0).getAdvisor());
                    assertEquals(2, resp.getBody().getDoctrineEffectiveness().get(0).getTotalUses());
                })
                .verifyComplete();
    }
}
