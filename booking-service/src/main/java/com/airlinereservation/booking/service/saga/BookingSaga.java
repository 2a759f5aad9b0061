package com.airlinereservation.booking.service.saga;

import com.airlinereservation.booking.service.retry.JitteredBackoff;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Undo log for one multi-leg booking.
 * <p>
 * Each committed leg registers the action that reverses it. On failure the actions run in
 * reverse registration order; every action is retried on its own and a failure of one does not
 * stop the others. Actions must be idempotent.
 */
@Slf4j
public class BookingSaga {

    private final Deque<CompensationStep> steps = new ArrayDeque<>();

    public void register(String description, Runnable action) {
        steps.push(new CompensationStep(description, action));
    }

    public int size() {
        return steps.size();
    }

    public CompensationResult compensate(int maxAttempts, JitteredBackoff backoff) {
        List<String> failedActions = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>();

        while (!steps.isEmpty()) {
            CompensationStep step = steps.pop();
            RuntimeException lastError = runWithRetry(step, maxAttempts, backoff);
            if (lastError != null) {
                log.error("Compensation failed permanently: action={}, error={}",
                        step.description(), lastError.getMessage(), lastError);
                failedActions.add(step.description());
                failures.add(lastError);
            }
        }

        return new CompensationResult(failedActions, failures);
    }

    private RuntimeException runWithRetry(CompensationStep step, int maxAttempts, JitteredBackoff backoff) {
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                step.action().run();
                log.info("Compensation applied: action={}, attempt={}", step.description(), attempt);
                return null;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Compensation attempt failed: action={}, attempt={}/{}, error={}",
                        step.description(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !backoff.pause(attempt)) {
                    break;
                }
            }
        }
        return lastError;
    }

    private record CompensationStep(String description, Runnable action) {
    }

    public record CompensationResult(List<String> failedActions, List<Throwable> failures) {

        public boolean isComplete() {
            return failedActions.isEmpty();
        }
    }
}
