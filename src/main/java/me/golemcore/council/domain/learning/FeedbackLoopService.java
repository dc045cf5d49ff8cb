package me.golemcore.council.domain.learning;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.knowledge.KnowledgeStoreService;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.DecisionRecord;
import me.golemcore.council.domain.model.OutcomeRecord;
import me.golemcore.council.domain.model.TrainingReport;
import me.golemcore.council.domain.model.TrainingSample;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Closes the loop from recorded outcomes back into scoring.
 *
 * <p>
 * A training cycle labels every decision that has an outcome and retrains the
 * learned prior from all of them. Knowledge attribution is incremental: each
 * decision reinforces (success) or penalizes (failure) the entries it used
 * exactly once, counting every use, and its key is then kept in
 * {@code learning/attributed-decisions.json} so later cycles skip it. Cycles
 * never overlap.
 */
@Service
@Slf4j
public class FeedbackLoopService {

    private static final String NEWLINE = "\n";
    private static final TypeReference<List<String>> KEY_LIST = new TypeReference<>() {
    };

    private final DecisionLedgerService decisionLedger;
    private final LabelGenerator labelGenerator;
    private final JudgmentPriorService judgmentPriorService;
    private final KnowledgeStoreService knowledgeStore;
    private final StoragePort storagePort;
    private final CouncilProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock cycleLock = new ReentrantLock();

    public FeedbackLoopService(DecisionLedgerService decisionLedger, LabelGenerator labelGenerator,
            JudgmentPriorService judgmentPriorService, KnowledgeStoreService knowledgeStore,
            StoragePort storagePort, CouncilProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.decisionLedger = decisionLedger;
        this.labelGenerator = labelGenerator;
        this.judgmentPriorService = judgmentPriorService;
        this.knowledgeStore = knowledgeStore;
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public TrainingReport runTrainingCycle(boolean force) {
        cycleLock.lock();
        try {
            List<DecisionLedgerService.LabeledDecision> labeled = decisionLedger.loadDecisionsWithOutcomes();
            List<TrainingSample> samples = new ArrayList<>(labeled.size());
            for (DecisionLedgerService.LabeledDecision item : labeled) {
                DecisionFeatures features = featuresOf(item.decision());
                samples.add(TrainingSample.builder()
                        .decisionKey(item.decision().getDecisionKey())
                        .features(features)
                        .label(labelGenerator.generateTypeWeights(features, item.outcome()))
                        .build());
            }

            TrainingReport report = train(samples, labeled, force);
            appendTrainingLog(report);
            return report;
        } finally {
            cycleLock.unlock();
        }
    }

    private TrainingReport train(List<TrainingSample> samples, List<DecisionLedgerService.LabeledDecision> labeled,
            boolean force) {
        int minSamples = properties.getLearning().getMinSamples();
        TrainingReport.TrainingReportBuilder report = TrainingReport.builder()
                .timestamp(clock.instant())
                .samples(samples.size());

        if (samples.isEmpty()) {
            return report.trained(false).reason("no decisions with recorded outcomes").build();
        }
        if (!force && samples.size() < minSamples) {
            return report.trained(false)
                    .reason("insufficient samples: " + samples.size() + " < " + minSamples)
                    .build();
        }
        if (!judgmentPriorService.train(samples, force)) {
            return report.trained(false).reason("failed to persist learned prior").build();
        }

        int buckets = (int) samples.stream()
                .map(sample -> JudgmentPriorService.computeSituationHash(sample.getFeatures()))
                .distinct()
                .count();
        report.trained(true).reason("trained").buckets(buckets);
        attributeNewOutcomes(labeled, report);
        TrainingReport result = report.build();
        log.info("[Learning] Training cycle complete: {} samples, {} buckets, {} new decisions attributed "
                + "({} reinforcements, {} penalties)", result.getSamples(), buckets,
                result.getDecisionsAttributed(), result.getEntriesReinforced(), result.getEntriesPenalized());
        return result;
    }

    private void attributeNewOutcomes(List<DecisionLedgerService.LabeledDecision> labeled,
            TrainingReport.TrainingReportBuilder report) {
        Set<String> attributed = loadAttributedKeys();
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> fresh = new ArrayList<>();

        for (DecisionLedgerService.LabeledDecision item : labeled) {
            DecisionRecord decision = item.decision();
            if (attributed.contains(decision.getDecisionKey())) {
                continue;
            }
            OutcomeRecord outcome = item.outcome();
            DecisionFeatures features = featuresOf(decision);
            List<String> entryIds = features.getKnowledge() != null ? features.getKnowledge().getEntryIds() : null;
            if (entryIds != null) {
                (outcome.isSuccess() ? succeeded : failed).addAll(entryIds);
            }
            fresh.add(decision.getDecisionKey());
        }
        if (fresh.isEmpty()) {
            return;
        }

        Optional<KnowledgeStoreService.Attribution> applied = knowledgeStore.attribute(succeeded, failed);
        if (applied.isEmpty()) {
            log.warn("[Learning] Knowledge attribution not persisted, {} decisions left for the next cycle",
                    fresh.size());
            return;
        }
        attributed.addAll(fresh);
        saveAttributedKeys(attributed);
        report.decisionsAttributed(fresh.size())
                .entriesReinforced(applied.get().reinforced())
                .entriesPenalized(applied.get().penalized());
    }

    private Set<String> loadAttributedKeys() {
        Set<String> keys = new TreeSet<>();
        try {
            String json = storagePort.getText(properties.getLearning().getDirectory(),
                    properties.getLearning().getAttributedFile()).join();
            if (json != null && !json.isBlank()) {
                keys.addAll(objectMapper.readValue(json, KEY_LIST));
            }
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Learning] Ignoring unreadable attribution record: {}", e.getMessage());
        }
        return keys;
    }

    private void saveAttributedKeys(Set<String> keys) {
        try {
            String json = objectMapper.writeValueAsString(new ArrayList<>(keys));
            storagePort.putTextAtomic(properties.getLearning().getDirectory(),
                    properties.getLearning().getAttributedFile(), json, true).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("[Learning] Failed to persist attribution record: {}", e.getMessage());
        }
    }

    private static DecisionFeatures featuresOf(DecisionRecord decision) {
        return decision.getFeatures() != null ? decision.getFeatures() : new DecisionFeatures();
    }

    private void appendTrainingLog(TrainingReport report) {
        try {
            String line = objectMapper.writeValueAsString(report) + NEWLINE;
            storagePort.appendText(properties.getLearning().getDirectory(),
                    properties.getLearning().getTrainingLogFile(), line).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Learning] Failed to append training log: {}", e.getMessage());
        }
    }
}
