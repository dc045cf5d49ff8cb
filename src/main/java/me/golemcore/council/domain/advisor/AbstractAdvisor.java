package me.golemcore.council.domain.advisor;

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
import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.model.AdvisorId;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.Doctrine;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.Position;
import me.golemcore.council.domain.model.Posture;
import me.golemcore.council.domain.model.Stance;
import me.golemcore.council.domain.service.TextSupport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Shared evaluation order for every seat: a doctrine prohibition found in the
 * input is an immediate red line, a doctrine worldview match decides the
 * stance next, and only then does the seat's own keyword heuristic run.
 *
 * <p>
 * Each seat also consults the knowledge base under its own domain and posture;
 * the ids of the entries it drew on travel with its position.
 */
@Slf4j
public abstract class AbstractAdvisor implements Advisor {

    static final double PROHIBITION_CONFIDENCE = 0.95;
    static final double WORLDVIEW_SUPPORT_RATIO = 0.3;
    static final double DOMAIN_CONFIDENCE = 0.8;
    static final int KNOWLEDGE_ITEMS = 3;

    private final AdvisorId id;
    private final Posture posture;
    private final Doctrine doctrine;
    private final KnowledgeScoringService knowledgeScoring;

    protected AbstractAdvisor(AdvisorId id, Posture posture, DoctrineCatalog doctrineCatalog,
            KnowledgeScoringService knowledgeScoring) {
        this.id = id;
        this.posture = posture;
        this.doctrine = doctrineCatalog.forAdvisor(id).orElse(null);
        this.knowledgeScoring = knowledgeScoring;
    }

    @Override
    public AdvisorId id() {
        return id;
    }

    @Override
    public final Position analyze(String input, DecisionContext context) {
        String text = TextSupport.normalize(input);
        DecisionContext safeContext = context != null ? context : new DecisionContext();
        KnowledgeSynthesis knowledge = consultKnowledge(input, safeContext);

        Position position = checkProhibitions(text)
                .or(() -> matchWorldview(text))
                .orElseGet(() -> evaluate(text, safeContext, knowledge));
        position.setAdvisor(id);
        position.setKnowledgeIds(knowledge.getEntries().stream()
                .map(scored -> scored.getEntry().getId())
                .toList());
        return position;
    }

    /**
     * Seat-specific heuristic, run when the doctrine has nothing to say.
     *
     * @param text
     *            lower-cased input
     */
    protected abstract Position evaluate(String text, DecisionContext context, KnowledgeSynthesis knowledge);

    protected Optional<Doctrine> doctrine() {
        return Optional.ofNullable(doctrine);
    }

    protected static boolean mentions(String text, Collection<String> keywords) {
        return TextSupport.containsAny(text, keywords);
    }

    protected static Position position(Stance stance, double confidence, String reasoning) {
        return Position.builder()
                .stance(stance)
                .confidence(confidence)
                .reasoning(reasoning)
                .build();
    }

    protected static Position redLine(double confidence, String reasoning) {
        Position position = position(Stance.OPPOSE, confidence, reasoning);
        position.setRedLineTriggered(true);
        return position;
    }

    private Optional<Position> checkProhibitions(String text) {
        if (doctrine == null) {
            return Optional.empty();
        }
        for (String prohibition : doctrine.getProhibitions()) {
            if (text.contains(TextSupport.normalize(prohibition))) {
                Position position = redLine(PROHIBITION_CONFIDENCE, "Doctrine prohibition triggered: " + prohibition);
                position.setDoctrineApplied(true);
                position.setConcerns(new ArrayList<>(List.of("prohibition_violation")));
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }

    private Optional<Position> matchWorldview(String text) {
        if (doctrine == null || doctrine.getWorldview().isEmpty()) {
            return Optional.empty();
        }
        List<String> worldview = doctrine.getWorldview();
        long matches = worldview.stream().filter(phrase -> TextSupport.containsKeyword(text, phrase)).count();
        if (matches == 0) {
            return Optional.empty();
        }
        double ratio = (double) matches / worldview.size();
        Position position = position(
                ratio > WORLDVIEW_SUPPORT_RATIO ? Stance.SUPPORT : Stance.NEUTRAL,
                Math.min(0.95, 0.5 + 0.45 * ratio),
                "Doctrine worldview match detected (" + matches + "/" + worldview.size() + ")");
        position.setDoctrineApplied(true);
        return Optional.of(position);
    }

    private KnowledgeSynthesis consultKnowledge(String input, DecisionContext context) {
        KnowledgeQuery query = KnowledgeQuery.builder()
                .text(input)
                .activeDomains(List.of(id.key()))
                .domainConfidence(DOMAIN_CONFIDENCE)
                .posture(posture)
                .frame(context.getAnalysis() != null ? context.frame() : null)
                .features(context.getFeatures())
                .maxItems(KNOWLEDGE_ITEMS)
                .build();
        try {
            return knowledgeScoring.synthesize(query);
        } catch (RuntimeException e) {
            log.warn("[Advisors] {} could not consult knowledge: {}", id.key(), e.getMessage());
            return KnowledgeSynthesis.builder().build();
        }
    }
}
