package me.golemcore.council.adapter.inbound.web.controller;

import me.golemcore.council.domain.learning.FeedbackLoopService;
import me.golemcore.council.domain.learning.JudgmentPriorService;
import me.golemcore.council.domain.model.LearnedBucket;
import me.golemcore.council.domain.model.TrainingReport;
import me.golemcore.council.domain.model.TypeWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LearningControllerTest {

    private FeedbackLoopService feedbackLoopService;
    private JudgmentPriorService judgmentPriorService;
    private LearningController controller;

    @BeforeEach
    void setUp() {
        feedbackLoopService = mock(FeedbackLoopService.class);
        judgmentPriorService = mock(JudgmentPriorService.class);
        controller = new LearningController(feedbackLoopService, judgmentPriorService);
    }

    @Test
    void trainShouldRunCycle() {
        when(feedbackLoopService.runTrainingCycle(true)).thenReturn(TrainingReport.builder()
                .trained(true)
                .samples(3)
                .build());

        StepVerifier.create(controller.train(true))
                .assertNext(resp -> {
                    assertTrue(resp.getBody().isTrained());
                    assertEquals(3, resp.getBody().getSamples());
                })
                .verifyComplete();
        verify(feedbackLoopService).runTrainingCycle(true);
    }

    @Test
    void priorsShouldBeSortedByBucket() {
        when(judgmentPriorService.buckets()).thenReturn(Map.of(
                "reversible_low_l", new LearnedBucket(TypeWeights.neutral(), 2),
                "irreversible_high_h", new LearnedBucket(new TypeWeights(1.2, 1.0, 1.3, 1.0, 0.8), 6)));

        StepVerifier.create(controller.priors())
                .assertNext(resp -> {
                    List<LearningController.PriorDto> priors = resp.getBody();
                    assertEquals(2, priors.size());
                    assertEquals("irreversible_high_h", priors.get(0).bucket());
                    assertEquals(6, priors.get(0).sampleCount());
                    assertEquals(JudgmentPriorService.confidenceFor(6), priors.get(0).confidence());
                    assertEquals("reversible_low_l", priors.get(1).bucket());
                })
                .verifyComplete();
    }

    @Test
    void priorsShouldBeEmptyBeforeTraining() {
        when(judgmentPriorService.buckets()).thenReturn(Map.of());

        StepVerifier.create(controller.priors())
                .assertNext(resp -> assertTrue(resp.getBody().isEmpty()))
                .verifyComplete();
    }
}
