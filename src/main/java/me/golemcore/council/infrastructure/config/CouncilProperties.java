package me.golemcore.council.infrastructure.config;

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

import lombok.Data;
import me.golemcore.council.domain.model.DecisionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the council engine, bound from {@code council.*}.
 *
 * <p>
 * Every group carries working defaults so the engine runs without any
 * external configuration file. Example:
 *
 * <pre>
 * council:
 *   storage:
 *     local:
 *       base-path: ${user.home}/.golemcore/council
 *   advisors:
 *     pool-size: 8
 *     timeout-ms: 2000
 *   authority:
 *     risk-threshold: 0.7
 *   learning:
 *     min-samples: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "council")
@Data
public class CouncilProperties {

    private StorageProperties storage = new StorageProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private AdvisorProperties advisors = new AdvisorProperties();
    private AuthorityProperties authority = new AuthorityProperties();
    private LearningProperties learning = new LearningProperties();
    private OutcomeProperties outcomes = new OutcomeProperties();
    private ClarificationProperties clarification = new ClarificationProperties();
    private UnderstandingProperties understanding = new UnderstandingProperties();
    private ModeProperties mode = new ModeProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/council";
    }

    @Data
    public static class KnowledgeProperties {
        private String directory = "knowledge";
        private String memoryStatsFile = "memory-stats.json";
        private int maxItems = 5;
        private boolean builtinFallback = true;
    }

    @Data
    public static class AdvisorProperties {
        private int poolSize = 8;
        private long timeoutMs = 2000;
        private String doctrineLocation = "classpath*:doctrine/*.yaml";
    }

    @Data
    public static class AuthorityProperties {
        private double riskThreshold = 0.7;
        private String doctrineName = "confidant";
    }

    @Data
    public static class LearningProperties {
        private boolean enabled = true;
        private int minSamples = 5;
        private double biasConfidenceThreshold = 0.6;
        private String directory = "learning";
        private String priorFile = "judgment-prior.json";
        private String trainingLogFile = "training-log.jsonl";
        private String attributedFile = "attributed-decisions.json";
    }

    @Data
    public static class OutcomeProperties {
        private String decisionsDirectory = "decisions";
        private String decisionLogFile = "decision-log.jsonl";
        private String outcomesDirectory = "outcomes";
        private double highRegretThreshold = 0.6;
    }

    @Data
    public static class ClarificationProperties {
        private int maxRounds = 3;
        private double qualityThreshold = 0.5;
    }

    @Data
    public static class UnderstandingProperties {
        private long timeoutMs = 3000;
        private int backgroundPoolSize = 2;
        private int maxConversations = 1000;
    }

    @Data
    public static class ModeProperties {
        private DecisionMode defaultMode = DecisionMode.MEETING;
    }
}
