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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.EnumFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.advisor.AdvisorRegistry;
import me.golemcore.council.domain.advisor.DoctrineCatalog;
import me.golemcore.council.domain.knowledge.KnowledgeStoreService;
import me.golemcore.council.domain.mode.ModeRouter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and the start-up summary.
 *
 * <p>
 * Advisors run on a fixed pool sized by {@code council.advisors.pool-size}, so
 * a burst of decisions queues instead of spawning threads. Background
 * situation analysis gets its own small pool so a slow text understanding
 * service never holds advisor or common-pool threads.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CouncilProperties properties;
    private final AdvisorRegistry advisorRegistry;
    private final KnowledgeStoreService knowledgeStore;
    private final ModeRouter modeRouter;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .enable(EnumFeature.WRITE_ENUMS_TO_LOWERCASE)
                .build();
    }

    @Bean
    public static DoctrineCatalog doctrineCatalog(CouncilProperties properties) {
        return DoctrineCatalog.load(properties.getAdvisors().getDoctrineLocation());
    }

    @Bean(name = "advisorExecutor", destroyMethod = "shutdown")
    public static ExecutorService advisorExecutor(CouncilProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getAdvisors().getPoolSize()),
                daemonThreads("advisor-"));
    }

    @Bean(name = "analysisExecutor", destroyMethod = "shutdown")
    public static ExecutorService analysisExecutor(CouncilProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getUnderstanding().getBackgroundPoolSize()),
                daemonThreads("analysis-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Council starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Advisors: {} registered, pool size {}, timeout {} ms", advisorRegistry.registered().size(),
                properties.getAdvisors().getPoolSize(), properties.getAdvisors().getTimeoutMs());
        log.info("Knowledge entries: {}{}", knowledgeStore.all().size(),
                knowledgeStore.isFallback() ? " (builtin fallback)" : "");
        log.info("Decision mode: {}", modeRouter.getMode());
    }
}
