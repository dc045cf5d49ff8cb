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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.council.domain.knowledge.KnowledgeScoringService;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.SituationFrame;
import me.golemcore.council.domain.service.TextSupport;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded question-and-answer loop that refines a knowledge query until the
 * candidate quality reaches the threshold or the rounds run out.
 *
 * <p>
 * Not thread-safe; one instance serves one conversation.
 */
@Slf4j
public class ClarificationLoop {

    public enum State {
        ASKING, AWAITING_ANSWER, RESCORING, SATISFIED, EXHAUSTED
    }

    static final double LOW_CLARITY = 0.5;
    static final String DOMAIN_QUESTION = "Which part of your life does this decision mainly affect: work, money, "
            + "relationships or health?";
    static final String CLARITY_QUESTION = "What exactly are the options you are choosing between?";
    static final String CONTEXT_QUESTION = "What constraints or deadlines apply to this decision?";

    private final KnowledgeScoringService knowledgeScoring;
    private final SituationHeuristics heuristics;
    private final int maxRounds;
    private final double qualityThreshold;

    private KnowledgeQuery query;
    private KnowledgeSynthesis synthesis;
    private State state;
    private int round;
    private String pendingQuestion;

    ClarificationLoop(KnowledgeScoringService knowledgeScoring, SituationHeuristics heuristics, int maxRounds,
            double qualityThreshold, KnowledgeQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query is required");
        }
        this.knowledgeScoring = knowledgeScoring;
        this.heuristics = heuristics;
        this.maxRounds = maxRounds;
        this.qualityThreshold = qualityThreshold;
        this.query = query;
        this.state = State.RESCORING;
        rescore();
    }

    /**
     * Hand out the pending question and wait for its answer.
     */
    public String nextQuestion() {
        requireState(State.ASKING, "nextQuestion");
        state = State.AWAITING_ANSWER;
        return pendingQuestion;
    }

    public State answer(String text) {
        requireState(State.AWAITING_ANSWER, "answer");
        round++;
        KnowledgeQuery.KnowledgeQueryBuilder refined = query.toBuilder();
        List<String> extra = new ArrayList<>(query.getExtraContext() != null ? query.getExtraContext() : List.of());
        if (text != null && !text.isBlank()) {
            extra.add(text);
            if (isEmpty(query.getActiveDomains())) {
                refined.activeDomains(heuristics.classifyDomains(TextSupport.normalize(text)).getDomains());
            }
        }
        query = refined.extraContext(extra).build();
        state = State.RESCORING;
        return rescore();
    }

    public State getState() {
        return state;
    }

    public int getRound() {
        return round;
    }

    public KnowledgeQuery getQuery() {
        return query;
    }

    public KnowledgeSynthesis getSynthesis() {
        return synthesis;
    }

    public boolean isFinished() {
        return state == State.SATISFIED || state == State.EXHAUSTED;
    }

    private State rescore() {
        synthesis = knowledgeScoring.synthesize(query);
        if (synthesis.getCandidateQuality() >= qualityThreshold) {
            state = State.SATISFIED;
        } else if (round >= maxRounds) {
            state = State.EXHAUSTED;
        } else {
            pendingQuestion = questionFor(query);
            state = State.ASKING;
        }
        log.debug("[KIS] Clarification round {}: quality {} -> {}", round, synthesis.getCandidateQuality(), state);
        return state;
    }

    private static String questionFor(KnowledgeQuery query) {
        if (isEmpty(query.getActiveDomains())) {
            return DOMAIN_QUESTION;
        }
        SituationFrame frame = query.getFrame();
        if (frame != null && frame.getClarity() < LOW_CLARITY) {
            return CLARITY_QUESTION;
        }
        return CONTEXT_QUESTION;
    }

    private void requireState(State expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " while " + state);
        }
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
