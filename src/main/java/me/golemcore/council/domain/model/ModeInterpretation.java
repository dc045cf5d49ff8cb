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

/**
 * Mode-specific reading of a council recommendation.
 */
public enum ModeInterpretation {

    // quick
    DIRECT_RESPONSE,

    // war
    AGGRESSIVE_PROCEED,
    DEFENSIVE_HOLD_OR_PIVOT,
    RED_LINE_BLOCK_OVERRIDE_NEEDED,

    // meeting
    STRONG_CONSENSUS_SUPPORT,
    STRONG_CONSENSUS_OPPOSE,
    MIXED_CONSENSUS_WITH_TRADEOFFS,

    // darbar
    RED_LINE_BLOCKS_RECOMMENDATION,
    STRONG_DOCTRINE_ALIGNED_CONSENSUS,
    CONSENSUS_WITH_NOTED_DISSENT,
    DEEP_DISAGREEMENT_DEFER_DECISION
}
