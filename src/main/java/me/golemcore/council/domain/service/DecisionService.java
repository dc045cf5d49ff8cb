package me.golemcore.council.domain.service;

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
import me.golemcore.council.domain.analysis.ClarificationLoop;
import me.golemcore.council.domain.analysis.ClarificationService;
import me.golemcore.council.domain.analysis.FeatureExtractor;
import me.golemcore.council.domain.analysis.SituationAnalysisService;
import me.golemcore.council.domain.authority.FinalAuthorityGate;
import me.golemcore.council.domain.council.CouncilService;
import me.golemcore.council.domain.learning.DecisionLedgerService;
import me.golemcore.council.domain.mode.ModeRouter;
import me.golemcore.council.domain.model.AuthorityVerdict;
import me.golemcore.council.domain.model.CouncilRecommendation;
import me.golemcore.council.domain.model.CouncilSession;
import me.golemcore.council.domain.model.DecisionContext;
import me.golemcore.council.domain.model.DecisionFeatures;
import me.golemcore.council.domain.model.DecisionMode;
import me.golemcore.council.domain.model.DecisionRecord;
import me.golemcore.council.domain.model.DecisionRequest;
import me.golemcore.council.domain.model.DecisionResult;
import me.golemcore.council.domain.model.KnowledgeQuery;
import me.golemcore.council.domain.model.KnowledgeSynthesis;
import me.golemcore.council.domain.model.ModeInterpretation;
import me.golemcore.council.domain.model.RoutingPlan;
import me.golemcore.council.domain.model.SituationAnalysis;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one utterance through the whole pipeline: analysis, routing, knowledge,
 * council, interpretation, final authority, and the decision ledger.
 *
 * <p>
 * When the request names a conversation, the turn is read in the light of the
 * conversation's latest analysis snapshot, and a fresh snapshot of the
 * conversation so far is computed in the background for the next turn.
 */
@Service
@Slf4j
public class DecisionService {

    private final SituationAnalysisService analysisService;
    private final ModeRouter modeRouter;
    private final ClarificationService clarificationService;
    private final FeatureExtractor featureExtractor;
    private final CouncilService councilService;
    private final FinalAuthorityGate finalAuthorityGate;
    private final DecisionLedgerService decisionLedger;

    public DecisionService(SituationAnalysisService analysisService, ModeRouter modeRouter,
            ClarificationService clarificationService, FeatureExtractor featureExtractor,
            CouncilService councilService, FinalAuthorityGate finalAuthorityGate,
            DecisionLedgerService decisionLedger) {
        this.analysisService = analysisService;
        this.modeRouter = modeRouter;
        this.clarificationService = clarificationService;
        this.featureExtractor = featureExtractor;
        this.councilService = councilService;
        this.finalAuthorityGate = finalAuthorityGate;
        this.decisionLedger = decisionLedger;
    }

    public DecisionResult decide(DecisionRequest request) {
        if (request == null || request.getInput() == null || request.getInput().isBlank()) {
            throw new IllegalArgumentException("Decision input is required");
        }
        String input = request.getInput();
        String conversationId = request.getConversationId();
        boolean inConversation = conversationId != null && !conversationId.isBlank();
        List<String> recentTurns = request.getRecentTurns() != null ? request.getRecentTurns() : List.of();

        SituationAnalysis analysis = inConversation
                ? analysisService.analyzeInContext(conversationId, input)
                : analysisService.analyze(input);

        DecisionMode mode = request.getMode() != null ? request.getMode() : modeRouter.getMode();
        RoutingPlan plan = modeRouter.route(mode, analysis);

        ClarificationLoop clarification = clarificationService.start(KnowledgeQuery.builder()
                .text(input)
                .activeDomains(new ArrayList<>(analysis.getClassification().getDomains()))
                .domainConfidence(analysis.getClassification().getConfidence())
                .frame(analysis.getFrame())
                .build());
        KnowledgeSynthesis knowledge = clarification.getSynthesis();
        DecisionFeatures features = featureExtractor.extract(input, analysis, knowledge);

        DecisionContext context = DecisionContext.builder()
                .analysis(analysis)
                .recentTurns(new ArrayList<>(recentTurns))
                .turnCount(recentTurns.size() + 1)
                .features(features)
                .build();

        CouncilSession session = null;
        CouncilRecommendation recommendation = null;
        AuthorityVerdict verdict = null;
        if (plan.isCouncilRequired()) {
            session = councilService.convene(plan.getAdvisors(), input, context);
            recommendation = session.getRecommendation();
            verdict = finalAuthorityGate.evaluate(recommendation, session.getPositions());
        }
        ModeInterpretation interpretation = modeRouter.interpret(mode, recommendation);

        String decisionKey = decisionLedger.newDecisionKey(input);
        boolean recorded = decisionLedger.recordDecision(DecisionRecord.builder()
                .decisionKey(decisionKey)
                .input(input)
                .mode(mode)
                .advisorsInvolved(new ArrayList<>(plan.getAdvisors()))
                .omittedAdvisors(session != null ? new ArrayList<>(session.getOmitted()) : new ArrayList<>())
                .positions(session != null ? new ArrayList<>(session.getPositions().values()) : new ArrayList<>())
                .recommendation(recommendation)
                .interpretation(interpretation)
                .verdict(verdict)
                .features(features)
                .build());

        if (inConversation) {
            analysisService.analyzeInBackground(conversationId, conversationText(recentTurns, input));
        }

        log.info("[Council] Decision {} in {} mode: {} advisors, interpretation {}, verdict {}", decisionKey,
                mode, plan.getAdvisors().size(), interpretation,
                verdict != null ? verdict.getFinalOutcome() : "none");

        return DecisionResult.builder()
                .decisionKey(decisionKey)
                .mode(mode)
                .analysis(analysis)
                .advisorsInvolved(new ArrayList<>(plan.getAdvisors()))
                .omittedAdvisors(session != null ? new ArrayList<>(session.getOmitted()) : new ArrayList<>())
                .council(session)
                .recommendation(recommendation)
                .interpretation(interpretation)
                .verdict(verdict)
                .features(features)
                .clarifyingQuestion(clarification.getState() == ClarificationLoop.State.ASKING
                        ? clarification.nextQuestion()
                        : null)
                .recorded(recorded)
                .build();
    }

    private static String conversationText(List<String> recentTurns, String input) {
        List<String> turns = new ArrayList<>(recentTurns);
        turns.add(input);
        return String.join("\n", turns);
    }
}
