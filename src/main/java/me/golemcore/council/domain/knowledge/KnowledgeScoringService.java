package me.golemcore.council.domain.knowledge;

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
import me.golemcore.council.domain.learning.JudgmentPriorService;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.KnowledgeEntry;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.KnowledgeUsage;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.Posture;
import me.golemcore.council.domain.model.PriorPrediction;
import me.golemcore.council.domain.model.ScoredEntry;
import me.golemcore.council.domain.model.SituationFrame;
import me.golemcore.council.domain.service.TextSupport;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Knowledge Importance Scoring.
 *
 * <p>
 * An entry's score is the product of five factors: domain fit, type weight,
 * reinforcement memory, query context overlap and goal orientation. Entries
 * whose applicability constraints reject the current situation score 0 before
 * any factor is computed.
 */
@Service
@Slf4j
public class KnowledgeScoringService {

    static final double INACTIVE_DOMAIN_WEIGHT = 0.25;
    static final double MIN_ACTIVE_DOMAIN_WEIGHT = 0.5;
    static final double MEMORY_FLOOR = 0.01;
    static final double PENALTY_DECAY = 0.3;
    static final double AGE_SCALE_DAYS = 180.0;
    static final double CONTRADICTION_DOMAIN_SIMILARITY = 0.4;

    private static final List<String> LONG_HORIZON_MARKERS = List.of(
            "dependency", "long-term", "long term", "trajectory", "control");
    private static final List<String> RELIEF_MARKERS = List.of(
            "temporary", "short-term", "short term", "relief");
    private static final List<String> NEGATION_MARKERS = List.of(
            "not ", "never ", "avoid ", "don't ", "do not ");

    private final KnowledgeStoreService knowledgeStore;
    private final JudgmentPriorService judgmentPriorService;
    private final CouncilProperties properties;
    private final Clock clock;

    public KnowledgeScoringService(KnowledgeStoreService knowledgeStore, JudgmentPriorService judgmentPriorService,
            CouncilProperties properties, Clock clock) {
        this.knowledgeStore = knowledgeStore;
        this.judgmentPriorService = judgmentPriorService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Score one entry without situation constraints or learned prior.
     *
     * @param domain
     *            domain to test against {@code activeDomains}; the entry's own
     *            domain when null
     */
    public double score(KnowledgeEntry entry, String domain, List<String> activeDomains, double domainConfidence,
            String contextText, Posture posture) {
        return score(entry, domain, activeDomains, domainConfidence, contextText, posture, null, null);
    }

    public double score(KnowledgeEntry entry, String domain, List<String> activeDomains, double domainConfidence,
            String contextText, Posture posture, SituationFrame frame, DecisionFeatures features) {
        if (entry == null || !isApplicable(entry, frame)) {
            return 0.0;
        }
        PriorPrediction prediction = features != null ? judgmentPriorService.predict(features) : null;
        return compose(entry, domain, activeDomains, domainConfidence, contextText, posture, prediction);
    }

    /**
     * Rank the whole knowledge base for a query and summarise the selection.
     */
    public KnowledgeSynthesis synthesize(KnowledgeQuery query) {
        if (query == null || query.getText() == null || query.getText().isBlank()
                || query.getActiveDomains() == null || query.getActiveDomains().isEmpty()) {
            return KnowledgeSynthesis.builder().build();
        }

        String contextText = contextText(query);
        PriorPrediction prediction = query.getFeatures() != null
                ? judgmentPriorService.predict(query.getFeatures())
                : null;
        List<KnowledgeEntry> candidates = knowledgeStore.all();

        List<ScoredEntry> scored = new ArrayList<>(candidates.size());
        for (KnowledgeEntry entry : candidates) {
            double value = isApplicable(entry, query.getFrame())
                    ? compose(entry, null, query.getActiveDomains(), query.getDomainConfidence(), contextText,
                            query.getPosture(), prediction)
                    : 0.0;
            scored.add(new ScoredEntry(entry, value));
        }
        // List.sort is stable, so equal scores keep insertion order
        scored.sort(Comparator.comparingDouble(ScoredEntry::getScore).reversed());

        int limit = query.getMaxItems() != null ? query.getMaxItems() : properties.getKnowledge().getMaxItems();
        List<ScoredEntry> top = scored.stream()
                .filter(candidate -> candidate.getScore() > 0.0)
                .limit(Math.max(0, limit))
                .toList();

        double average = top.stream().mapToDouble(ScoredEntry::getScore).average().orElse(0.0);
        KnowledgeSynthesis synthesis = KnowledgeSynthesis.builder()
                .entries(new ArrayList<>(top))
                .averageScore(average)
                .candidateQuality(average / (1.0 + average))
                .contradictions(findContradictions(top))
                .totalScanned(candidates.size())
                .fallbackUsed(knowledgeStore.isFallback())
                .usage(usageOf(top))
                .build();
        log.debug("[KIS] Selected {} of {} entries, quality {}", top.size(), candidates.size(),
                String.format(Locale.ROOT, "%.3f", synthesis.getCandidateQuality()));
        return synthesis;
    }

    /**
     * False when the entry declares constraints the situation violates. A
     * missing frame is read as a neutral one.
     */
    public boolean isApplicable(KnowledgeEntry entry, SituationFrame frame) {
        KnowledgeEntry.Applicability applicability = entry.getApplicability();
        if (applicability == null) {
            return true;
        }
        SituationFrame situation = frame != null ? frame : SituationFrame.neutral();
        String frameDomain = TextSupport.normalize(situation.getDomain());

        List<String> required = applicability.getRequiredDomains();
        if (required != null && !required.isEmpty()
                && required.stream().noneMatch(domain -> TextSupport.normalize(domain).equals(frameDomain))) {
            return false;
        }
        List<String> excluded = applicability.getExcludedDomains();
        if (excluded != null && excluded.stream().anyMatch(domain -> TextSupport.normalize(domain).equals(frameDomain))) {
            return false;
        }

        Level stakes = situation.getStakes() != null ? situation.getStakes() : Level.LOW;
        if (applicability.getMinStakes() != null && stakes.isBelow(applicability.getMinStakes())) {
            return false;
        }
        Level timePressure = situation.getTimePressure() != null ? situation.getTimePressure() : Level.LOW;
        return applicability.getMaxTimePressure() == null || !timePressure.isAbove(applicability.getMaxTimePressure());
    }

    public double domainWeight(KnowledgeEntry entry, String domain, List<String> activeDomains,
            double domainConfidence) {
        List<String> active = activeDomains != null ? activeDomains : List.of();
        String candidate = TextSupport.normalize(domain != null ? domain : entry.getDomain());

        double weight = active.stream().anyMatch(activeDomain -> TextSupport.normalize(activeDomain).equals(candidate))
                ? Math.max(domainConfidence, MIN_ACTIVE_DOMAIN_WEIGHT)
                : INACTIVE_DOMAIN_WEIGHT;

        List<String> tags = entry.getConceptTags();
        if (tags != null && !tags.isEmpty()) {
            double best = 0.0;
            for (String tag : tags) {
                for (String activeDomain : active) {
                    best = Math.max(best, TextSupport.labelSimilarity(tag, activeDomain));
                }
            }
            weight = Math.max(weight, best * domainConfidence);
        }
        return weight;
    }

    public double typeWeight(KnowledgeEntry entry, Posture posture, PriorPrediction prediction) {
        double weight = entry.getType().getBaseWeight();
        if (posture != null) {
            weight *= posture.bias(entry.getType());
        }
        if (prediction != null
                && prediction.getConfidence() >= properties.getLearning().getBiasConfidenceThreshold()) {
            weight *= prediction.getWeights().get(entry.getType());
        }
        return weight;
    }

    /**
     * {@code (1 + ln(1 + rc)) * exp(-0.3 * pc) * exp(-ageDays / 180)}, floored
     * at 0.01. Age counts from the last reinforcement, when there was one.
     */
    public double memoryWeight(KnowledgeEntry.MemoryStats memory) {
        if (memory == null) {
            return 1.0;
        }
        double weight = 1.0 + Math.log(1.0 + Math.max(0, memory.getReinforcementCount()));
        if (memory.getPenaltyCount() > 0) {
            weight *= Math.exp(-PENALTY_DECAY * memory.getPenaltyCount());
        }
        Instant lastReinforcedAt = memory.getLastReinforcedAt();
        if (lastReinforcedAt != null) {
            double ageDays = Math.max(0.0, Duration.between(lastReinforcedAt, clock.instant()).toMillis()
                    / (double) Duration.ofDays(1).toMillis());
            weight *= Math.exp(-ageDays / AGE_SCALE_DAYS);
        }
        return Math.max(MEMORY_FLOOR, weight);
    }

    public double contextWeight(KnowledgeEntry entry, String contextText) {
        Set<String> keywords = TextSupport.extractKeywords(contextText);
        String content = TextSupport.normalize(entry.getContent());

        double weight;
        if (keywords.isEmpty() || content.isBlank()) {
            weight = 0.8;
        } else {
            long matches = keywords.stream().filter(content::contains).count();
            if (matches >= 2) {
                weight = 1.4;
            } else if (matches == 1) {
                weight = 1.2;
            } else {
                weight = 0.85;
            }
        }

        List<String> goalTags = entry.getGoalTags();
        if (goalTags != null && !goalTags.isEmpty() && !keywords.isEmpty()) {
            double best = 0.0;
            for (String goalTag : goalTags) {
                for (String keyword : keywords) {
                    best = Math.max(best, TextSupport.labelSimilarity(goalTag, keyword));
                }
            }
            weight = Math.max(weight, 0.5 + 0.5 * best);
        }
        return weight;
    }

    public double goalWeight(KnowledgeEntry entry) {
        String content = entry.getContent();
        if (TextSupport.containsAny(content, LONG_HORIZON_MARKERS)) {
            return 1.2;
        }
        if (TextSupport.containsAny(content, RELIEF_MARKERS)) {
            return 0.7;
        }
        return 1.0;
    }

    private double compose(KnowledgeEntry entry, String domain, List<String> activeDomains, double domainConfidence,
            String contextText, Posture posture, PriorPrediction prediction) {
        return domainWeight(entry, domain, activeDomains, domainConfidence)
                * typeWeight(entry, posture, prediction)
                * memoryWeight(entry.getMemory())
                * contextWeight(entry, contextText)
                * goalWeight(entry);
    }

    private List<KnowledgeSynthesis.Contradiction> findContradictions(List<ScoredEntry> selected) {
        List<KnowledgeSynthesis.Contradiction> contradictions = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            KnowledgeEntry first = selected.get(i).getEntry();
            for (int j = i + 1; j < selected.size(); j++) {
                KnowledgeEntry second = selected.get(j).getEntry();
                double similarity = TextSupport.labelSimilarity(first.getDomain(), second.getDomain());
                if (similarity >= CONTRADICTION_DOMAIN_SIMILARITY && hasNegation(first) != hasNegation(second)) {
                    contradictions.add(KnowledgeSynthesis.Contradiction.builder()
                            .firstId(first.getId())
                            .secondId(second.getId())
                            .domainSimilarity(similarity)
                            .build());
                }
            }
        }
        return contradictions;
    }

    private boolean hasNegation(KnowledgeEntry entry) {
        String content = TextSupport.normalize(entry.getContent());
        return NEGATION_MARKERS.stream().anyMatch(content::contains);
    }

    private KnowledgeUsage usageOf(List<ScoredEntry> selected) {
        KnowledgeUsage usage = new KnowledgeUsage();
        Set<String> ids = new LinkedHashSet<>();
        for (ScoredEntry candidate : selected) {
            usage.getUsedTypes().add(candidate.getEntry().getType());
            ids.add(candidate.getEntry().getId());
        }
        usage.getEntryIds().addAll(ids);
        return usage;
    }

    private String contextText(KnowledgeQuery query) {
        if (query.getExtraContext() == null || query.getExtraContext().isEmpty()) {
            return query.getText();
        }
        return query.getText() + " " + String.join(" ", query.getExtraContext());
    }
}
