package me.golemcore.council.adapter.outbound.understanding;

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
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.port.outbound.TextUnderstandingPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Stand-in used when no text understanding service is wired. Reports itself
 * unavailable so the analysis service goes straight to its heuristics.
 */
@Component
@Slf4j
public class NoOpTextUnderstandingAdapter implements TextUnderstandingPort {

    @Override
    public CompletableFuture<SituationAnalysis> understand(String input) {
        log.debug("[Analysis] No text understanding service configured");
        return CompletableFuture.failedFuture(
                new IllegalStateException("Text understanding service is not configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
