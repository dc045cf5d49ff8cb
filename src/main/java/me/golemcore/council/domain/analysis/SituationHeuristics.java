package me.golemcore.council.domain.analysis;

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

import me.golemcore.council.domain.model.DomainClassification;
import me.golemcore.council.domain.model.EmotionalMetrics;
import me.golemcore.council.domain.model.Level;
import me.golemcore.council.domain.model.SituationAnalysis;
import me.golemcore.council.domain.model.SituationFrame;
import me.golemcore.council.domain.service.TextSupport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword reading of an utterance, used whenever the text understanding
 * collaborator is unavailable. Deterministic and local.
 */
@Component
public class SituationHeuristics {

    static final String DEFAULT_DOMAIN = "strategy";
    static final double DEFAULT_DOMAIN_CONFIDENCE = 0.6;
    static final int MAX_DOMAINS = 3;
    static final int SHORT_UTTERANCE_WORDS = 3;

    private static final List<String> DECISION_WORDS = List.of(
            "decid", "decision", "whether", "choose", "quit", "leave");
    private static final List<String> EMOTIONAL_WORDS = List.of(
            "overwhelm", "stress", "anx", "panic", "burnout", "burned out", "sad", "depress", "scared", "afraid",
            "lonely", "angry", "upset", "exhausted");
    private static final List<String> HIGH_STAKES_WORDS = List.of(
            "urgent", "emergency", "critical", "crisis", "dangerous", "risk", "life", "death", "health", "quit",
            "resign", "bankruptcy", "disaster");
    private static final List<String> MEDIUM_STAKES_WORDS = List.of(
            "soon", "important", "concern", "worried", "conflict", "trouble", "problem", "issue", "struggling",
            "difficulty");
    private static final List<String> HIGH_URGENCY_WORDS = List.of(
            "urgent", "immediately", "emergency", "right now", "asap", "today", "tonight");
    private static final List<String> MEDIUM_URGENCY_WORDS = List.of(
            "soon", "deadline", "this week", "tomorrow", "quickly");

    static final Map<String, List<String>> DOMAIN_KEYWORDS = domainKeywords();

    public SituationAnalysis analyze(String input) {
        String text = TextSupport.normalize(input);
        DomainClassification classification = classifyDomains(text);
        SituationFrame frame = frame(text, classification.primaryDomain());
        return SituationAnalysis.builder()
                .frame(frame)
                .classification(classification)
                .metrics(metrics(frame))
                .source(SituationAnalysis.Source.HEURISTIC)
                .build();
    }

    public SituationFrame frame(String text, String domain) {
        SituationFrame.SituationFrameBuilder frame = SituationFrame.builder()
                .domain(domain)
                .stakes(stakes(text))
                .timePressure(timePressure(text));
        if (TextSupport.containsAny(text, DECISION_WORDS)) {
            return frame.situationType(SituationFrame.SituationType.DECISION).clarity(0.7).emotionalLoad(0.3).build();
        }
        if (TextSupport.containsAny(text, EMOTIONAL_WORDS)) {
            return frame.situationType(SituationFrame.SituationType.EMOTIONAL).clarity(0.5).emotionalLoad(0.8).build();
        }
        int words = TextSupport.tokenize(text).size();
        double clarity = words <= SHORT_UTTERANCE_WORDS ? 0.5 : 0.7;
        return frame.situationType(SituationFrame.SituationType.CASUAL).clarity(clarity).emotionalLoad(0.1).build();
    }

    public DomainClassification classifyDomains(String text) {
        Map<String, Integer> matches = new LinkedHashMap<>();
        DOMAIN_KEYWORDS.forEach((domain, keywords) -> {
            int count = TextSupport.countMatches(text, keywords);
            if (count > 0) {
                matches.put(domain, count);
            }
        });
        if (matches.isEmpty()) {
            return DomainClassification.builder()
                    .domains(new ArrayList<>(List.of(DEFAULT_DOMAIN)))
                    .confidence(DEFAULT_DOMAIN_CONFIDENCE)
                    .build();
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(matches.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        List<String> domains = ranked.stream().limit(MAX_DOMAINS).map(Map.Entry::getKey).toList();
        return DomainClassification.builder()
                .domains(new ArrayList<>(domains))
                .confidence(Math.min(1.0, ranked.get(0).getValue() / 5.0))
                .build();
    }

    /**
     * True when at least one domain keyword occurs in the input.
     */
    public boolean hasDomainSignal(String input) {
        String text = TextSupport.normalize(input);
        return DOMAIN_KEYWORDS.values().stream().anyMatch(keywords -> TextSupport.containsAny(text, keywords));
    }

    public Level stakes(String text) {
        if (TextSupport.countMatches(text, HIGH_STAKES_WORDS) >= 1) {
            return Level.HIGH;
        }
        if (TextSupport.countMatches(text, MEDIUM_STAKES_WORDS) >= 2) {
            return Level.MEDIUM;
        }
        return Level.LOW;
    }

    public Level timePressure(String text) {
        if (TextSupport.containsAny(text, HIGH_URGENCY_WORDS)) {
            return Level.HIGH;
        }
        if (TextSupport.containsAny(text, MEDIUM_URGENCY_WORDS)) {
            return Level.MEDIUM;
        }
        return Level.LOW;
    }

    private EmotionalMetrics metrics(SituationFrame frame) {
        double load = frame.getEmotionalLoad();
        return EmotionalMetrics.builder()
                .emotionalMaturity(0.5)
                .volatility(load * 0.5)
                .stress(load)
                .confidence(frame.getClarity())
                .build();
    }

    private static Map<String, List<String>> domainKeywords() {
        Map<String, List<String>> keywords = new LinkedHashMap<>();
        keywords.put("career", List.of("job", "career", "work", "employment", "promotion", "quit", "resign",
                "hiring", "interview", "boss", "manager", "colleague", "salary", "raise", "workplace",
                "professional"));
        keywords.put("financial", List.of("money", "savings", "debt", "income", "invest", "budget", "afford",
                "loan", "mortgage", "salary", "expenses", "financial"));
        keywords.put("relationships", List.of("partner", "wife", "husband", "girlfriend", "boyfriend", "friend",
                "family", "marriage", "divorce", "break up", "relationship", "dating"));
        keywords.put("health", List.of("health", "sick", "illness", "doctor", "surgery", "sleep", "exercise",
                "diet", "pain", "medical"));
        keywords.put("strategy", List.of("plan", "strategy", "goal", "objective", "approach", "decision",
                "choose", "direction", "long-term", "timeline", "priority"));
        keywords.put("power", List.of("control", "influence", "authority", "power", "negotiate", "bargain",
                "leverage", "advantage", "dominance", "competition"));
        keywords.put("ethics", List.of("ethical", "moral", "honest", "lie", "cheat", "fair", "integrity",
                "values", "legal"));
        keywords.put("innovation", List.of("startup", "invent", "innovation", "new product", "prototype",
                "launch", "disrupt", "idea"));
        keywords.put("psychology", List.of("stress", "anxiety", "depression", "mental", "emotional", "feel",
                "overwhelm", "burnout", "confidence", "self-esteem", "identity", "therapy", "mindset"));
        keywords.put("risk", List.of("risk", "danger", "safe", "security", "loss", "fail", "uncertain",
                "expensive"));
        keywords.put("timing", List.of("now", "urgent", "deadline", "season", "moment", "ready", "wait",
                "delay", "rush", "soon", "later", "patience"));
        keywords.put("optionality", List.of("flexible", "option", "choice", "freedom", "alternative", "backup",
                "contingency", "plan b", "escape", "pivot", "switch"));
        keywords.put("technology", List.of("tech", "technology", "digital", "software", "automation", "ai",
                "platform", "system", "tool", "upgrade"));
        return Collections.unmodifiableMap(keywords);
    }
}
