package me.golemcore.council.domain.analysis;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.DomainClassification;
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.domain.model.VersionedSnapshot;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.TextUnderstandingPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads an utterance into a {@link SituationAnalysis}.
 *
 * <p>
 * The text understanding service is asked first, bounded by
 * {@code council.understanding.timeout-ms}. Anything short of a usable answer
 * falls back to {@link SituationHeuristics}, so analysis itself never fails.
 * Background analyses publish immutable, versioned snapshots per conversation;
 * an older analysis finishing late never replaces a newer one. At most
 * {@code council.understanding.max-conversations} conversations are tracked;
 * past that the least recently used ones are forgotten.
 */
@Service
@Slf4j
public class SituationAnalysisService {

    private final TextUnderstandingPort textUnderstanding;
    private final SituationHeuristics heuristics;
    private final CouncilProperties properties;
    private final ExecutorService analysisExecutor;
    private final Clock clock;

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final AtomicLong touches = new AtomicLong();

    public SituationAnalysisService(TextUnderstandingPort textUnderstanding, SituationHeuristics heuristics,
            CouncilProperties properties, @Qualifier("analysisExecutor") ExecutorService analysisExecutor,
            Clock clock) {
        this.textUnderstanding = textUnderstanding;
        this.heuristics = heuristics;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;
        this.clock = clock;
    }

    public SituationAnalysis analyze(String input) {
        if (input == null || input.isBlank()) {
            return heuristics.analyze("");
        }
        if (!textUnderstanding.isAvailable()) {
            return heuristics.analyze(input);
        }
        try {
            SituationAnalysis analysis = textUnderstanding.understand(input)
                    .get(properties.getUnderstanding().getTimeoutMs(), TimeUnit.MILLISECONDS);
            if (isUsable(analysis)) {
                analysis.setSource(SituationAnalysis.Source.UPSTREAM);
                return analysis;
            }
            log.warn("[Analysis] Text understanding returned an unusable result, using heuristics");
        } catch (TimeoutException e) {
            log.warn("[Analysis] Text understanding timed out after {} ms, using heuristics",
                    properties.getUnderstanding().getTimeoutMs());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Analysis] Text understanding failed, using heuristics: {}", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Analysis] Interrupted while waiting for text understanding, using heuristics");
        } catch (RuntimeException e) {
            log.warn("[Analysis] Text understanding failed, using heuristics: {}", e.getMessage());
        }
        return heuristics.analyze(input);
    }

    /**
     * Analyze one turn of a conversation. A turn with no domain signal of its
     * own, such as a short follow-up, inherits the domains of the latest
     * conversation snapshot.
     */
    public SituationAnalysis analyzeInContext(String conversationId, String input) {
        SituationAnalysis analysis = analyze(input);
        if (analysis.getSource() != SituationAnalysis.Source.HEURISTIC || heuristics.hasDomainSignal(input)) {
            return analysis;
        }
        latestSnapshot(conversationId).ifPresent(snapshot -> {
            log.debug("[Analysis] Carrying domains from snapshot v{} of conversation {}", snapshot.getVersion(),
                    conversationId);
            DomainClassification previous = snapshot.getAnalysis().getClassification();
            analysis.setClassification(new DomainClassification(new ArrayList<>(previous.getDomains()),
                    previous.getConfidence()));
            analysis.getFrame().setDomain(previous.primaryDomain());
        });
        return analysis;
    }

    /**
     * Analyze the input off the caller's thread and publish the result as the
     * conversation's latest snapshot.
     *
     * @return completes with the snapshot this call produced
     */
    public CompletableFuture<VersionedSnapshot> analyzeInBackground(String conversationId, String input) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is required");
        }
        Conversation conversation = conversation(conversationId);
        long version = conversation.version.incrementAndGet();
        return CompletableFuture.supplyAsync(() -> {
            VersionedSnapshot snapshot = new VersionedSnapshot(version, input, analyze(input), clock.instant());
            conversation.latest.accumulateAndGet(snapshot, SituationAnalysisService::newer);
            log.debug("[Analysis] Published snapshot v{} for conversation {}", version, conversationId);
            return snapshot;
        }, analysisExecutor);
    }

    public Optional<VersionedSnapshot> latestSnapshot(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        Conversation conversation = conversations.get(conversationId);
        if (conversation == null) {
            return Optional.empty();
        }
        conversation.lastTouch = touches.incrementAndGet();
        return Optional.ofNullable(conversation.latest.get());
    }

    public int trackedConversations() {
        return conversations.size();
    }

    private Conversation conversation(String conversationId) {
        Conversation existing = conversations.get(conversationId);
        if (existing == null && conversations.size() >= Math.max(1, properties.getUnderstanding()
                .getMaxConversations())) {
            evictLeastRecentlyUsed();
        }
        Conversation conversation = conversations.computeIfAbsent(conversationId, id -> new Conversation());
        conversation.lastTouch = touches.incrementAndGet();
        return conversation;
    }

    private void evictLeastRecentlyUsed() {
        // Drop ~10% of the tracked conversations, oldest first
        int toRemove = Math.max(1, conversations.size() / 10);
        List<Map.Entry<String, Conversation>> entries = new ArrayList<>(conversations.entrySet());
        entries.sort(Comparator.comparingLong(entry -> entry.getValue().lastTouch));
        for (int i = 0; i < toRemove && i < entries.size(); i++) {
            conversations.remove(entries.get(i).getKey());
        }
        log.debug("[Analysis] Evicted {} idle conversations", Math.min(toRemove, entries.size()));
    }

    private static VersionedSnapshot newer(VersionedSnapshot current, VersionedSnapshot candidate) {
        return current == null || candidate.getVersion() > current.getVersion() ? candidate : current;
    }

    private static boolean isUsable(SituationAnalysis analysis) {
        return analysis != null && analysis.getFrame() != null && analysis.getClassification() != null
                && analysis.getMetrics() != null;
    }

    private static final class Conversation {
        private final AtomicLong version = new AtomicLong();
        private final AtomicReference<VersionedSnapshot> latest = new AtomicReference<>();
        private volatile long lastTouch;
    }
}
