package com.example.websearcher.service;

import com.example.websearcher.agent.AgentAction;
import com.example.websearcher.agent.DecisionStream;
import com.example.websearcher.agent.StepEvent;
import com.example.websearcher.model.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a question against a session's agent in the background. Progress and the
 * outcome are only ever published through the session state; nothing is thrown
 * back to the caller once the query has been accepted.
 */
@Service
public class QueryExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutionEngine.class);

    private final ExecutorService queryExecutor;

    public QueryExecutionEngine(@Qualifier("queryExecutor") ExecutorService queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    /**
     * Starts a query and returns immediately with the {@code processing} state.
     *
     * @throws QueryInProgressException if the session is already processing a query
     * @throws IllegalArgumentException if the question is blank or {@code maxSteps} is below 1
     */
    public SessionState submit(SessionRecord record, String question, int maxSteps) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1");
        }
        SessionState started = record.beginQuery(question);
        QueryRun run = new QueryRun(started.getGeneration());
        record.attachRun(run);
        if (record.isClosed()) {
            run.cancel();
            return started;
        }

        try {
            Future<?> task = queryExecutor.submit(() -> execute(record, run, question, maxSteps));
            run.bind(task);
        } catch (RejectedExecutionException e) {
            logger.error("Could not schedule query for session {}", record.getId(), e);
            record.update(run.getGeneration(), state -> state.failed("Query could not be scheduled: " + e.getMessage()));
            run.markDone();
        }
        logger.info("Started query in session {}: {}", record.getId(), question);
        return started;
    }

    void execute(SessionRecord record, QueryRun run, String question, int maxSteps) {
        if (!run.start()) {
            return;
        }
        long generation = run.getGeneration();
        String sessionId = record.getId();
        int step = 0;
        try {
            DecisionStream stream = record.getDecisionGraph().stream(question);
            while (true) {
                if (isCancelled(record, run)) {
                    logger.info("Query in session {} cancelled after {} steps", sessionId, step);
                    return;
                }
                StepEvent event = stream.next();
                if (event.isEnd()) {
                    // graph finished without an answer
                    record.update(generation, state -> state.completed(null));
                    logger.info("Query in session {} ended without an answer", sessionId);
                    return;
                }
                if (!event.hasPrediction()) {
                    continue;
                }

                step++;
                AgentAction action = event.getPrediction();
                int currentStep = step;
                String description = action.describe();
                logger.debug("Session {} step {}: {}", sessionId, currentStep, description);

                if (action instanceof AgentAction.Answer) {
                    String answer = ((AgentAction.Answer) action).result();
                    record.update(generation, state -> state.withProgress(currentStep, description).completed(answer));
                    logger.info("Query in session {} completed after {} steps", sessionId, currentStep);
                    return;
                }
                if (currentStep > maxSteps) {
                    String message = "Max steps (" + maxSteps + ") exceeded";
                    record.update(generation, state -> state.withProgress(currentStep, description).failed(message));
                    logger.warn("Query in session {} stopped: {}", sessionId, message);
                    return;
                }
                record.update(generation, state -> state.withProgress(currentStep, description));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Query in session {} interrupted after {} steps", sessionId, step);
        } catch (Exception e) {
            if (isCancelled(record, run)) {
                logger.debug("Query in session {} failed after cancellation: {}", sessionId, e.toString());
                return;
            }
            logger.error("Query error in session {}: {}", sessionId, e.getMessage(), e);
            record.update(generation, state -> state.failed(describe(e)));
        } finally {
            run.markDone();
        }
    }

    private static boolean isCancelled(SessionRecord record, QueryRun run) {
        return record.isClosed() || run.isCancelled() || Thread.currentThread().isInterrupted();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }
}
