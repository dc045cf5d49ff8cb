package me.golemcore.council.port.outbound;

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

import me.golemcore.council.domain.model.SituationAnalysis;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the external text understanding service that classifies an
 * utterance into a situation frame, active domains and emotional metrics.
 *
 * <p>
 * Callers treat every failure of this port as recoverable: a timeout, an
 * exceptional completion or an unusable result all lead to the local
 * heuristic reading instead.
 */
public interface TextUnderstandingPort {

    CompletableFuture<SituationAnalysis> understand(String input);

    boolean isAvailable();
}
