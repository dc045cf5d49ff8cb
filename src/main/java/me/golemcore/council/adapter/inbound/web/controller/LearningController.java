package me.golemcore.council.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.council.domain.learning.FeedbackLoopService;
import me.golemcore.council.domain.learning.JudgmentPriorService;
import me.golemcore.council.domain.model.LearnedBucket;
import me.golemcore.council.domain.model.TrainingReport;
import me.golemcore.council.domain.model.TypeWeights;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Training trigger and read-only view of the learned prior.
 */
@RestController
@RequestMapping("/api/learning")
@RequiredArgsConstructor
public class LearningController {

    private final FeedbackLoopService feedbackLoopService;
    private final JudgmentPriorService judgmentPriorService;

    @PostMapping("/train")
    public Mono<ResponseEntity<TrainingReport>> train(@RequestParam(defaultValue = "false") boolean force) {
        return Mono.fromCallable(() -> ResponseEntity.ok(feedbackLoopService.runTrainingCycle(force)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/priors")
    public Mono<ResponseEntity<List<PriorDto>>> priors() {
        List<PriorDto> priors = judgmentPriorService.buckets().entrySet().stream()
                .sorted(Map.Entry.comparingByKey(Comparator.naturalOrder()))
                .map(entry -> toDto(entry.getKey(), entry.getValue()))
                .toList();
        return Mono.just(ResponseEntity.ok(priors));
    }

    private static PriorDto toDto(String bucket, LearnedBucket learned) {
        return new PriorDto(bucket, learned.getWeights(), learned.getSampleCount(),
                JudgmentPriorService.confidenceFor(learned.getSampleCount()));
    }

    public record PriorDto(String bucket, TypeWeights weights, int sampleCount, double confidence) {
    }
}
