package me.golemcore.council.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.council.domain.learning.DecisionLedgerService;
import me.golemcore.council.domain.model.OutcomeRecord;
import me.golemcore.council.domain.model.OutcomeStatistics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Real-world outcome reporting for recorded decisions.
 */
@RestController
@RequestMapping("/api/outcomes")
@RequiredArgsConstructor
public class OutcomeController {

    private final DecisionLedgerService decisionLedger;

    @PostMapping("/{decisionKey}")
    public Mono<ResponseEntity<OutcomeResponse>> recordOutcome(@PathVariable String decisionKey,
            @RequestBody(required = false) OutcomeRequest request) {
        if (request == null || request.success() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "success is required"));
        }
        OutcomeRecord outcome = OutcomeRecord.builder()
                .decisionKey(decisionKey)
                .success(request.success())
                .regretScore(request.regretScore() != null ? request.regretScore() : 0.0)
                .recoveryTimeDays(request.recoveryTimeDays() != null ? request.recoveryTimeDays() : 0.0)
                .secondaryDamage(Boolean.TRUE.equals(request.secondaryDamage()))
                .build();
        return Mono.fromCallable(() -> ResponseEntity.ok(new OutcomeResponse(decisionLedger.recordOutcome(outcome))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/statistics")
    public Mono<ResponseEntity<OutcomeStatistics>> statistics() {
        return Mono.fromCallable(() -> ResponseEntity.ok(decisionLedger.statistics()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    public record OutcomeRequest(Boolean success, Double regretScore, Double recoveryTimeDays,
            Boolean secondaryDamage) {
    }

    public record OutcomeResponse(boolean recorded) {
    }
}
