package me.golemcore.council.domain.knowledge;

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

import me.golemcore.council.domain.model.KnowledgeEntry;
import me.golemcore.council.domain.model.KnowledgeType;

import java.util.List;

/**
 * Fixed entries served when the knowledge base is empty or unreadable, so that
 * scoring always has something to rank across the common domains.
 */
final class BuiltinKnowledge {

    private BuiltinKnowledge() {
    }

    static List<KnowledgeEntry> entries() {
        return List.of(
                entry("builtin-1", "career_risk", KnowledgeType.WARNING,
                        "Quitting without financial buffer leaves you vulnerable. Ensure 6-12 months expenses saved "
                                + "before major career transitions.",
                        "builtin:risk_guide", 2, List.of("risk", "career", "financial")),
                entry("builtin-2", "optionality_guide", KnowledgeType.ADVICE,
                        "Plan alternatives before committing. Keep multiple paths open to maintain negotiating power.",
                        "builtin:optionality_guide", 5, List.of("optionality", "strategy", "power")),
                entry("builtin-3", "psychology_of_work", KnowledgeType.PRINCIPLE,
                        "Stress and burnout reduce decision quality. Prioritize recovery and mental health during "
                                + "high-stakes periods.",
                        "builtin:psychology_guide", 1, List.of("psychology", "health", "career")),
                entry("builtin-4", "personal_finance", KnowledgeType.RULE,
                        "Prioritize emergency savings. Build 3-month liquid reserves before investing in growth "
                                + "opportunities.",
                        "builtin:finance_guide", 3, List.of("financial", "risk", "risk_resources")),
                entry("builtin-5", "decision_theory", KnowledgeType.PRINCIPLE,
                        "Irreversible decisions warrant extra scrutiny. Reversible decisions can be optimized through "
                                + "iteration.",
                        "builtin:decision_theory", 4, List.of("strategy", "optionality", "risk")),
                entry("builtin-6", "power_technology", KnowledgeType.RULE,
                        "Technological adoption curves follow S-patterns. Early adoption provides advantage; late "
                                + "adoption faces diminishing returns.",
                        "builtin:tech_guide", 2, List.of("technology", "innovation", "power")),
                entry("builtin-7", "intel_and_comm", KnowledgeType.ADVICE,
                        "Resilient communications maintain clarity under pressure. Practice key messages before "
                                + "high-stakes conversations.",
                        "builtin:communication_guide", 1, List.of("intelligence", "diplomacy", "relationships")));
    }

    private static KnowledgeEntry entry(String id, String domain, KnowledgeType type, String content,
            String book, int reinforcements, List<String> conceptTags) {
        return KnowledgeEntry.builder()
                .id(id)
                .domain(domain)
                .type(type)
                .content(content)
                .source(KnowledgeEntry.KnowledgeSource.builder().book(book).build())
                .memory(KnowledgeEntry.MemoryStats.builder().reinforcementCount(reinforcements).build())
                .conceptTags(List.copyOf(conceptTags))
                .build();
    }
}
