package me.golemcore.council.domain.council;

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
import me.golemcore.council.domain.advisor.Advisor;
import me.golemcore.council.domain.advisor.AdvisorRegistry;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.CouncilSession;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.OmittedAdvisor;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.infrastructure.config.CouncilProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Convenes a set of advisors on the bounded advisor pool and aggregates what
 * comes back.
 *
 * <p>
 * An advisor that throws, times out or is not registered is left out of the
 * vote and listed as omitted; the rest of the council still decides. Judge
 * positions are kept for audit but never counted.
 */
@Service
@Slf4j
public class CouncilService {

    private final AdvisorRegistry advisorRegistry;
    private final CouncilAggregator councilAggregator;
    private final ExecutorService advisorExecutor;
    private final CouncilProperties properties;

    public CouncilService(AdvisorRegistry advisorRegistry, CouncilAggregator councilAggregator,
            @Qualifier("advisorExecutor") ExecutorService advisorExecutor, CouncilProperties properties) {
        this.advisorRegistry = advisorRegistry;
        this.councilAggregator = councilAggregator;
        this.advisorExecutor = advisorExecutor;
        this.properties = properties;
    }

    public CouncilSession convene(List<AdvisorId> advisorIds, String input, DecisionContext context) {
        CouncilSession session = new CouncilSession();
        Map<AdvisorId, Future<Position>> pending = new LinkedHashMap<>();

        for (AdvisorId advisorId : advisorIds) {
            Advisor advisor = advisorRegistry.find(advisorId).orElse(null);
            if (advisor == null) {
                omit(session, advisorId, OmittedAdvisor.Reason.NOT_REGISTERED, "no advisor registered");
                continue;
            }
            try {
                pending.put(advisorId, advisorExecutor.submit(() -> advisor.analyze(input, context)));
            } catch (RejectedExecutionException e) {
                omit(session, advisorId, OmittedAdvisor.Reason.FAILED, "advisor pool rejected task");
            }
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getAdvisors().getTimeoutMs());
        for (Map.Entry<AdvisorId, Future<Position>> entry : pending.entrySet()) {
            AdvisorId advisorId = entry.getKey();
            Future<Position> future = entry.getValue();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                Position position = future.get(remaining, TimeUnit.NANOSECONDS);
                if (position == null) {
                    omit(session, advisorId, OmittedAdvisor.Reason.FAILED, "advisor returned no position");
                } else if (advisorId.isJudge()) {
                    session.getJudgeObservations().put(advisorId, position);
                } else {
                    session.getPositions().put(advisorId, position);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                omit(session, advisorId, OmittedAdvisor.Reason.TIMED_OUT,
                        "no position within " + properties.getAdvisors().getTimeoutMs() + " ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                omit(session, advisorId, OmittedAdvisor.Reason.FAILED, cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                omit(session, advisorId, OmittedAdvisor.Reason.FAILED, "interrupted");
            }
        }

        session.setRecommendation(councilAggregator.aggregate(session.getPositions()));
        log.debug("[Council] Convened {} advisors: {} counted, {} judges, {} omitted", advisorIds.size(),
                session.getPositions().size(), session.getJudgeObservations().size(), session.getOmitted().size());
        return session;
    }

    private void omit(CouncilSession session, AdvisorId advisorId, OmittedAdvisor.Reason reason, String detail) {
        log.warn("[Council] Omitting advisor {} ({}): {}", advisorId.key(), reason, detail);
        session.getOmitted().add(OmittedAdvisor.builder()
                .advisor(advisorId)
                .reason(reason)
                .detail(detail)
                .build());
    }
}
