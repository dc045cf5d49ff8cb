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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of council seats. Nineteen seats vote; judges observe and are
 * recorded for audit but never counted.
 */
public enum AdvisorId {

    ADAPTATION(false),
    CONFLICT(false),
    DIPLOMACY(false),
    DATA(false),
    DISCIPLINE(false),
    GRAND_STRATEGIST(false),
    INTELLIGENCE(false),
    TIMING(false),
    RISK(false),
    POWER(false),
    PSYCHOLOGY(false),
    TECHNOLOGY(false),
    LEGITIMACY(false),
    TRUTH(false),
    NARRATIVE(false),
    SOVEREIGN(false),
    OPTIONALITY(false),
    RISK_RESOURCES(false),
    WAR_MODE(false),
    TRIBUNAL(true);

    private final boolean judge;

    AdvisorId(boolean judge) {
        this.judge = judge;
    }

    public boolean isJudge() {
        return judge;
    }

    /**
     * Lower-case identifier used in doctrine file names and persisted records.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<AdvisorId> voting() {
        return Arrays.stream(values()).filter(id -> !id.judge).toList();
    }

    public static List<AdvisorId> judges() {
        return Arrays.stream(values()).filter(AdvisorId::isJudge).toList();
    }

    public static AdvisorId fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Advisor key is required");
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown advisor: " + key, e);
        }
    }
}
