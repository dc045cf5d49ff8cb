package me.golemcore.council.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final word on a council recommendation, with the gate state that decided it
 * and every state the gate passed through.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthorityVerdict {

    public enum FinalOutcome {
        ACCEPT, ACCEPT_WITH_MITIGATION, DEFER, REJECT
    }

    public enum GateState {
        CONSTRAINT_CHECK, DISTORTION_CHECK, PATTERN_CHECK, OUTCOME_EVALUATION, TERMINAL
    }

    private FinalOutcome finalOutcome;
    private String reason;
    private GateState decidedIn;

    @Builder.Default
    private List<GateState> path = new ArrayList<>();
}
