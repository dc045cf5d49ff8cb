package me.golemcore.council.adapter.inbound.web.controller;

import me.golemcore.council.domain.mode.DarbarModeStrategy;
import me.golemcore.council.domain.mode.MeetingModeStrategy;
import me.golemcore.council.domain.mode.ModeRouter;
import me.golemcore.council.domain.mode.QuickModeStrategy;
import me.golemcore.council.domain.mode.WarModeStrategy;
import me.golemcore.council.domain.model.DecisionMode;
import me.golemcore.council.domain.model.DecisionRequest;
import me.golemcore.council.domain.model.DecisionResult;
import me.golemcore.council.domain.model.ModeInterpretation;
import me.golemcore.council.domain.service.DecisionService;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionControllerTest {

    private DecisionService decisionService;
    private ModeRouter modeRouter;
    private DecisionController controller;

    @BeforeEach
    void setUp() {
        decisionService = mock(DecisionService.class);
        modeRouter = new ModeRouter(List.of(new QuickModeStrategy(), new WarModeStrategy(),
                new MeetingModeStrategy(), new DarbarModeStrategy()), new CouncilProperties());
        controller = new DecisionController(decisionService, modeRouter);
    }

    @Test
    void decideShouldPassRequestToService() {
        when(decisionService.decide(any(DecisionRequest.class))).thenReturn(DecisionResult.builder()
                .decisionKey("dec_1_0a1b2c3d")
                .mode(DecisionMode.WAR)
                .interpretation(ModeInterpretation.AGGRESSIVE_PROCEED)
                .build());

        StepVerifier.create(controller.decide(new DecisionController.DecideRequest(
                "Ship it tonight?", "WAR", List.of("We finished testing"), "conv-1")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    DecisionResult body = resp.getBody();
                    assertNotNull(body);
                    assertEquals("dec_1_0a1b2c3d", body.getDecisionKey());
                    assertEquals(ModeInterpretation.AGGRESSIVE_PROCEED, body.getInterpretation());
                })
                .verifyComplete();

        ArgumentCaptor<DecisionRequest> captor = ArgumentCaptor.forClass(DecisionRequest.class);
        verify(decisionService).decide(captor.capture());
        assertEquals(DecisionMode.WAR, captor.getValue().getMode());
        assertEquals("conv-1", captor.getValue().getConversationId());
        assertEquals(List.of("We finished testing"), captor.getValue().getRecentTurns());
    }

    @Test
    void decideShouldLeaveModeUnsetWhenAbsent() {
        when(decisionService.decide(any(DecisionRequest.class))).thenReturn(new DecisionResult());

        StepVerifier.create(controller.decide(new DecisionController.DecideRequest("Take it?", null, null, null)))
                .assertNext(resp -> assertEquals(HttpStatus.OK, resp.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<DecisionRequest> captor = ArgumentCaptor.forClass(DecisionRequest.class);
        verify(decisionService).decide(captor.capture());
        assertNull(captor.getValue().getMode());
        assertTrue(captor.getValue().getRecentTurns().isEmpty());
    }

    @Test
    void decideShouldRejectBlankInput() {
        StepVerifier.create(controller.decide(new DecisionController.DecideRequest(" ", null, null, null)))
                .expectErrorSatisfies(error -> {
                    ResponseStatusException ex = (ResponseStatusException) error;
                    assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
                })
                .verify();
        verify(decisionService, never()).decide(any(DecisionRequest.class));
    }

    @Test
    void decideShouldRejectUnknownMode() {
        DecisionController.DecideRequest request = new DecisionController.DecideRequest("Take it?", "parliament",
                null, null);

        assertThrows(IllegalArgumentException.class, () -> controller.decide(request));
    }

    @Test
    void modeShouldBeReadableAndSwitchable() {
        StepVerifier.create(controller.getMode())
                .assertNext(resp -> assertEquals(DecisionMode.MEETING, resp.getBody().mode()))
                .verifyComplete();

        StepVerifier.create(controller.setMode(new DecisionController.ModeRequest("darbar")))
                .assertNext(resp -> assertEquals(DecisionMode.DARBAR, resp.getBody().mode()))
                .verifyComplete();

        assertEquals(DecisionMode.DARBAR, modeRouter.getMode());
    }

    @Test
    void setModeShouldRejectMissingMode() {
        StepVerifier.create(controller.setMode(new DecisionController.ModeRequest(null)))
                .expectError(ResponseStatusException.class)
                .verify();
    }
}
