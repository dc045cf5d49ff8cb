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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.DecisionRecord;
import me.golemcore.council.domain.model.DoctrineEffectiveness;
import me.golemcore.council.domain.model.OutcomeRecord;
import me.golemcore.council.domain.model.OutcomeStatistics;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import me.golemcore.council.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Persistent record of decisions and their real-world outcomes.
 *
 * <p>
 * Decisions are appended to a JSONL log. Each outcome is a separate document
 * named after its decision key and written atomically, so recording an outcome
 * twice replaces it and there is never more than one outcome per decision.
 */
@Service
@Slf4j
public class DecisionLedgerService {

    private static final String LOG_PREFIX = "[Outcomes]";
    private static final String NEWLINE = "\n";
    private static final String JSON_EXTENSION = ".json";
    private static final Pattern DECISION_KEY = Pattern.compile("dec_\\d+_[0-9a-f]{8}");

    private final StoragePort storagePort;
    private final CouncilProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public DecisionLedgerService(StoragePort storagePort, CouncilProperties properties, ObjectMapper objectMapper,
            Clock clock) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * New key of the form {@code dec_{epochMillis}_{hash8}}.
     */
    public String newDecisionKey(String input) {
        long millis = clock.millis();
        String seed = millis + ":" + sequence.incrementAndGet() + ":" + (input != null ? input : "");
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return "dec_" + millis + "_" + HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean recordDecision(DecisionRecord decision) {
        if (decision == null || decision.getDecisionKey() == null) {
            return false;
        }
        if (decision.getTimestamp() == null) {
            decision.setTimestamp(clock.instant());
        }
        try {
            String line = objectMapper.writeValueAsString(decision) + NEWLINE;
            storagePort.appendText(decisionsDirectory(), properties.getOutcomes().getDecisionLogFile(), line).join();
            log.info("{} Recorded decision {}", LOG_PREFIX, decision.getDecisionKey());
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to record decision {}: {}", LOG_PREFIX, decision.getDecisionKey(), e.getMessage());
            return false;
        }
    }

    /**
     * Store the outcome of a known decision, replacing any earlier outcome for
     * the same key.
     *
     * @return false for unknown keys, out-of-range values or a failed write
     */
    public boolean recordOutcome(OutcomeRecord outcome) {
        if (!isValid(outcome)) {
            return false;
        }
        if (findDecision(outcome.getDecisionKey()).isEmpty()) {
            log.warn("{} Ignoring outcome for unknown decision {}", LOG_PREFIX, outcome.getDecisionKey());
            return false;
        }
        OutcomeRecord stored = OutcomeRecord.builder()
                .decisionKey(outcome.getDecisionKey())
                .success(outcome.isSuccess())
                .regretScore(outcome.getRegretScore())
                .recoveryTimeDays(outcome.getRecoveryTimeDays())
                .secondaryDamage(outcome.isSecondaryDamage())
                .timestamp(outcome.getTimestamp() != null ? outcome.getTimestamp() : clock.instant())
                .build();
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(stored);
            storagePort.putTextAtomic(outcomesDirectory(), stored.getDecisionKey() + JSON_EXTENSION, json, false)
                    .join();
            log.info("{} Recorded outcome for {} (success={})", LOG_PREFIX, stored.getDecisionKey(),
                    stored.isSuccess());
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to record outcome for {}: {}", LOG_PREFIX, stored.getDecisionKey(), e.getMessage());
            return false;
        }
    }

    public Optional<OutcomeRecord> findOutcome(String decisionKey) {
        if (decisionKey == null || !DECISION_KEY.matcher(decisionKey).matches()) {
            return Optional.empty();
        }
        String file = decisionKey + JSON_EXTENSION;
        try {
            if (!Boolean.TRUE.equals(storagePort.exists(outcomesDirectory(), file).join())) {
                return Optional.empty();
            }
            String json = storagePort.getText(outcomesDirectory(), file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, OutcomeRecord.class));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to read outcome {}: {}", LOG_PREFIX, decisionKey, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<DecisionRecord> findDecision(String decisionKey) {
        if (decisionKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(loadDecisions().get(decisionKey));
    }

    /**
     * Every logged decision, keyed and ordered by first appearance. A key logged
     * twice keeps its latest line.
     */
    public Map<String, DecisionRecord> loadDecisions() {
        Map<String, DecisionRecord> decisions = new LinkedHashMap<>();
        String content;
        try {
            content = storagePort.getText(decisionsDirectory(), properties.getOutcomes().getDecisionLogFile()).join();
        } catch (RuntimeException e) {
            log.warn("{} Failed to read decision log: {}", LOG_PREFIX, e.getMessage());
            return decisions;
        }
        if (content == null || content.isBlank()) {
            return decisions;
        }
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                DecisionRecord decision = objectMapper.readValue(line, DecisionRecord.class);
                if (decision.getDecisionKey() != null) {
                    decisions.put(decision.getDecisionKey(), decision);
                }
            } catch (JsonProcessingException e) {
                log.trace("{} Skipping malformed decision line: {}", LOG_PREFIX, e.getMessage());
            }
        }
        return decisions;
    }

    /**
     * Decisions that have an outcome, in log order.
     */
    public List<LabeledDecision> loadDecisionsWithOutcomes() {
        List<LabeledDecision> labeled = new ArrayList<>();
        for (DecisionRecord decision : loadDecisions().values()) {
            findOutcome(decision.getDecisionKey())
                    .ifPresent(outcome -> labeled.add(new LabeledDecision(decision, outcome)));
        }
        return labeled;
    }

    /**
     * Aggregate outcome figures over every decision that has one, including the
     * success rate of each advisor's doctrine across the decisions where it
     * shaped that advisor's position.
     */
    public OutcomeStatistics statistics() {
        Map<String, DecisionRecord> decisions = loadDecisions();
        Map<AdvisorId, int[]> doctrineTally = new EnumMap<>(AdvisorId.class);
        int withOutcome = 0;
        int successes = 0;
        int highRegret = 0;
        int secondaryDamage = 0;
        double regretSum = 0.0;
        double highRegretThreshold = properties.getOutcomes().getHighRegretThreshold();

        for (String key : decisions.keySet()) {
            Optional<OutcomeRecord> found = findOutcome(key);
            if (found.isEmpty()) {
                continue;
            }
            OutcomeRecord outcome = found.get();
            withOutcome++;
            regretSum += outcome.getRegretScore();
            if (outcome.isSuccess()) {
                successes++;
            }
            if (outcome.getRegretScore() > highRegretThreshold) {
                highRegret++;
            }
            if (outcome.isSecondaryDamage()) {
                secondaryDamage++;
            }
            tallyDoctrines(decisions.get(key), outcome.isSuccess(), doctrineTally);
        }

        return OutcomeStatistics.builder()
                .totalDecisions(decisions.size())
                .withOutcome(withOutcome)
                .successes(successes)
                .successRate(withOutcome == 0 ? 0.0 : (double) successes / withOutcome)
                .averageRegret(withOutcome == 0 ? 0.0 : regretSum / withOutcome)
                .highRegret(highRegret)
                .secondaryDamage(secondaryDamage)
                .doctrineEffectiveness(toEffectiveness(doctrineTally))
                .build();
    }

    private static void tallyDoctrines(DecisionRecord decision, boolean success, Map<AdvisorId, int[]> tally) {
        if (decision.getPositions() == null) {
            return;
        }
        for (Position position : decision.getPositions()) {
            if (position == null || position.getAdvisor() == null || !position.isDoctrineApplied()) {
                continue;
            }
            // [0] successes, [1] failures
            tally.computeIfAbsent(position.getAdvisor(), id -> new int[2])[success ? 0 : 1]++;
        }
    }

    private static List<DoctrineEffectiveness> toEffectiveness(Map<AdvisorId, int[]> tally) {
        List<DoctrineEffectiveness> report = new ArrayList<>(tally.size());
        tally.forEach((advisor, counts) -> {
            int total = counts[0] + counts[1];
            report.add(DoctrineEffectiveness.builder()
                    .advisor(advisor)
                    .successes(counts[0])
                    .failures(counts[1])
                    .totalUses(total)
                    .successRate((double) counts[0] / total)
                    .build());
        });
        return report;
    }

    private boolean isValid(OutcomeRecord outcome) {
        if (outcome == null || outcome.getDecisionKey() == null
                || !DECISION_KEY.matcher(outcome.getDecisionKey()).matches()) {
            log.warn("{} Rejecting outcome with malformed decision key", LOG_PREFIX);
            return false;
        }
        double regret = outcome.getRegretScore();
        if (Double.isNaN(regret) || regret < 0.0 || regret > 1.0) {
            log.warn("{} Rejecting outcome for {}: regret {} outside [0, 1]", LOG_PREFIX,
                    outcome.getDecisionKey(), regret);
            return false;
        }
        double recovery = outcome.getRecoveryTimeDays();
        if (Double.isNaN(recovery) || recovery < 0.0) {
            log.warn("{} Rejecting outcome for {}: negative recovery time", LOG_PREFIX, outcome.getDecisionKey());
            return false;
        }
        return true;
    }

    private String decisionsDirectory() {
        return properties.getOutcomes().getDecisionsDirectory();
    }

    private String outcomesDirectory() {
        return properties.getOutcomes().getOutcomesDirectory();
    }

    /**
     * A logged decision joined with its recorded outcome.
     */
    public record LabeledDecision(DecisionRecord decision, OutcomeRecord outcome) {
    }
}
