package me.golemcore.council.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.council.domain.mode.ModeRouter;
import me.golemcore.council.domain.model.DecisionMode;
import me.golemcore.council.domain.model.DecisionRequest;
import me.golemcore.council.domain.model.DecisionResult;
import me.golemcore.council.domain.service.DecisionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

/**
 * Decision endpoints: run an utterance through the council and read or switch
 * the router's mode.
 */
@RestController
@RequestMapping("/api/decisions")
@RequiredArgsConstructor
public class DecisionController {

    private final DecisionService decisionService;
    private final ModeRouter modeRouter;

    @PostMapping
    public Mono<ResponseEntity<DecisionResult>> decide(@RequestBody(required = false) DecideRequest request) {
        if (request == null || request.input() == null || request.input().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "input is required"));
        }
        DecisionMode mode = request.mode() != null && !request.mode().isBlank()
                ? DecisionMode.fromValue(request.mode())
                : null;
        DecisionRequest decisionRequest = DecisionRequest.builder()
                .input(request.input())
                .mode(mode)
                .conversationId(request.conversationId())
                .recentTurns(request.recentTurns() != null ? new ArrayList<>(request.recentTurns()) : new ArrayList<>())
                .build();
        return Mono.fromCallable(() -> ResponseEntity.ok(decisionService.decide(decisionRequest)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/mode")
    public Mono<ResponseEntity<ModeResponse>> getMode() {
        return Mono.just(ResponseEntity.ok(new ModeResponse(modeRouter.getMode())));
    }

    @PutMapping("/mode")
    public Mono<ResponseEntity<ModeResponse>> setMode(@RequestBody(required = false) ModeRequest request) {
        if (request == null || request.mode() == null || request.mode().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "mode is required"));
        }
        DecisionMode mode = modeRouter.setMode(DecisionMode.fromValue(request.mode()));
        return Mono.just(ResponseEntity.ok(new ModeResponse(mode)));
    }

    public record DecideRequest(String input, String mode, List<String> recentTurns, String conversationId) {
    }

    public record ModeRequest(String mode) {
    }

    public record ModeResponse(DecisionMode mode) {
    }
}
