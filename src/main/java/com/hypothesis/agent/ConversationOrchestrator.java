package com.hypothesis.agent;

import com.hypothesis.agent.tool.ToolRegistry;
import com.hypothesis.configuration.ResearchProperties;
import com.hypothesis.core.Hypothesis;
import com.hypothesis.core.Mode;
import com.hypothesis.core.Plan;
import com.hypothesis.core.Session;
import com.hypothesis.core.StepResult;
import com.hypothesis.core.Turn;
import com.hypothesis.core.TurnState;
import com.hypothesis.exception.PlanGenerationException;
import com.hypothesis.exception.ResearchException;
import com.hypothesis.exception.TurnAbandonedException;
import com.hypothesis.exception.UnknownToolException;
import com.hypothesis.service.LanguageModelGateway;
import com.hypothesis.service.SessionService;
import com.hypothesis.util.TranscriptFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for one conversational turn.
 *
 * <pre>
 * IDLE -> CLASSIFYING -> CONVERSATIONAL_REPLY | RESEARCH_PIPELINE -> IDLE
 * </pre>
 *
 * <p>A session handles one turn at a time. Every turn ends with a reply: a conversational answer, a
 * hypothesis, or an apology when planning fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationOrchestrator {

    static final String PLANNING_APOLOGY = "Sorry, I couldn't work out how to research that with the data I have "
        + "(KEGG pathways and GO annotations). Could you rephrase the question or make it more specific?";
    static final String REPLY_APOLOGY = "Sorry, I'm having trouble answering right now. Please try again in a moment.";
    static final String ABANDONED = "Research stopped before completion; partial results were discarded.";

    private final SessionService sessionService;
    private final ModeClassifier classifier;
    private final ResearchPlanner planner;
    private final PlanExecutor executor;
    private final HypothesisSynthesizer synthesizer;
    private final ToolRegistry registry;
    private final LanguageModelGateway gateway;
    private final ResearchProperties properties;

    public TurnResponse handleTurn(String sessionId, String utterance) {
        Session session = sessionService.getOrCreate(sessionId);
        session.getTurnLock().lock();
        try {
            session.resetAbandoned();
            log.info("[{}] turn started ({} turns in history)", session.getId(), session.size());

            transition(session, TurnState.CLASSIFYING);
            Mode mode = classifier.classify(session, utterance);
            session.setMode(mode);

            TurnResponse response = mode == Mode.RESEARCH
                ? research(session, utterance)
                : conversational(session, utterance);

            log.info("[{}] turn finished in {} mode (degraded: {})", session.getId(), response.getMode(),
                response.isDegraded());
            return response;

        } finally {
            transition(session, TurnState.IDLE);
            session.getTurnLock().unlock();
        }
    }

    /**
     * Clears the history and failure counters of a session. Waits for an in-flight turn.
     *
     * @return false if the session does not exist
     */
    public boolean clearSession(String sessionId) {
        return sessionService.find(sessionId).map(session -> {
            session.getTurnLock().lock();
            try {
                session.clear();
                log.info("[{}] history cleared", sessionId);
                return true;
            } finally {
                session.getTurnLock().unlock();
            }
        }).orElse(false);
    }

    /**
     * Stops the in-flight turn of a session before its next plan step.
     *
     * @return false if the session does not exist
     */
    public boolean abandonTurn(String sessionId) {
        return sessionService.find(sessionId).map(session -> {
            session.abandonActiveTurn();
            log.info("[{}] abandon requested", sessionId);
            return true;
        }).orElse(false);
    }

    private TurnResponse conversational(Session session, String utterance) {
        transition(session, TurnState.CONVERSATIONAL_REPLY);
        String reply = reply(session, utterance);
        record(session, utterance, Turn.conversational(reply));
        return baseResponse(session, Mode.CONVERSATIONAL, reply).build();
    }

    private TurnResponse research(Session session, String utterance) {
        transition(session, TurnState.RESEARCH_PIPELINE);

        Plan plan;
        List<StepResult> results;
        try {
            plan = planner.plan(utterance, registry, session);
            results = executor.execute(plan, session);
        } catch (PlanGenerationException | UnknownToolException e) {
            log.warn("[{}] research pipeline rejected the plan ({}): {}", session.getId(), e.getKind(),
                e.getMessage());
            transition(session, TurnState.CONVERSATIONAL_REPLY);
            session.setMode(Mode.CONVERSATIONAL);
            record(session, utterance, Turn.conversational(PLANNING_APOLOGY));
            return baseResponse(session, Mode.CONVERSATIONAL, PLANNING_APOLOGY).planningFailed(true).build();
        } catch (TurnAbandonedException e) {
            log.info("[{}] {}", session.getId(), e.getMessage());
            record(session, utterance, Turn.conversational(ABANDONED));
            return baseResponse(session, Mode.RESEARCH, ABANDONED).build();
        }

        Hypothesis hypothesis = synthesizer.synthesize(utterance, plan, results, session.getId());
        record(session, utterance, Turn.research(hypothesis, plan, results));

        return baseResponse(session, Mode.RESEARCH, hypothesis.text())
            .followUps(hypothesis.followUps())
            .plan(plan)
            .results(results)
            .build();
    }

    private String reply(Session session, String utterance) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("history", TranscriptFormatter.format(session.recentTurns(properties.getPromptHistoryTurns())));
        variables.put("utterance", utterance);
        try {
            String reply = gateway.completeText("conversational-reply", variables, "ConversationalReply",
                session.getId());
            return reply == null || reply.isBlank() ? REPLY_APOLOGY : reply.trim();
        } catch (ResearchException e) {
            log.warn("[{}] conversational reply failed ({}): {}", session.getId(), e.getKind(), e.getMessage());
            return REPLY_APOLOGY;
        }
    }

    private void record(Session session, String utterance, Turn systemTurn) {
        session.append(Turn.user(utterance));
        session.append(systemTurn);
    }

    private TurnResponse.TurnResponseBuilder baseResponse(Session session, Mode mode, String text) {
        return TurnResponse.builder()
            .sessionId(session.getId())
            .mode(mode)
            .text(text)
            .degraded(session.getFatalFailures() >= properties.getDegradedThreshold());
    }

    private void transition(Session session, TurnState next) {
        log.debug("[{}] {} -> {}", session.getId(), session.getState(), next);
        session.setState(next);
    }
}
