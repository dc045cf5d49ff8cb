package me.golemcore.council;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for GolemCore Council.
 *
 * <p>
 * GolemCore Council is a decision-support engine: it ranks knowledge entries,
 * convenes a council of domain advisors, aggregates their votes into one
 * recommendation, passes it through a final authority gate and learns bounded
 * weight adjustments from recorded outcomes.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * Input              → SituationAnalysisService (port + heuristics)
 * Routing            → ModeRouter (quick / war / meeting / darbar)
 * Council            → Advisors → KnowledgeScoringService → CouncilAggregator
 * Final authority    → FinalAuthorityGate
 * Learning           → DecisionLedgerService → FeedbackLoopService → JudgmentPriorService
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code council.*}
 * prefix, see {@link me.golemcore.council.infrastructure.config.CouncilProperties}.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class CouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(CouncilApplication.class, args);
    }

}
