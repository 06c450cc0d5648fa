package com.healthsentinel.service.runtime;

import com.healthsentinel.core.model.RetryPolicy;
import com.healthsentinel.probes.api.DeliveryResult;

/**
 * Drives one delivery through its attempts. Each instance is used for a single delivery.
 * <pre>
 * ATTEMPTING --success--> SUCCEEDED
 * ATTEMPTING --failure, attempts left--> WAITING --delay--> ATTEMPTING
 * ATTEMPTING --failure, none left--> EXHAUSTED
 * any --interrupt--> ABANDONED
 * </pre>
 */
final class RetryLoop {
    enum Phase {
        ATTEMPTING,
        WAITING,
        SUCCEEDED,
        EXHAUSTED,
        ABANDONED
    }

    @FunctionalInterface
    interface Attempt {
        DeliveryResult run(int attemptNumber) throws InterruptedException;
    }

    record Result(Phase phase, int attempts, String lastError) {
        boolean success() {
            return phase == Phase.SUCCEEDED;
        }
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private Phase phase = Phase.ATTEMPTING;
    private int attempts;
    private String lastError;

    RetryLoop(RetryPolicy policy, Sleeper sleeper) {
        this.policy = policy;
        this.sleeper = sleeper;
    }

    Result run(Attempt attempt) {
        while (phase == Phase.ATTEMPTING || phase == Phase.WAITING) {
            if (phase == Phase.ATTEMPTING) {
                attemptOnce(attempt);
            } else {
                waitBeforeNextAttempt();
            }
        }
        return new Result(phase, attempts, lastError);
    }

    private void attemptOnce(Attempt attempt) {
        attempts++;
        DeliveryResult result;
        try {
            result = attempt.run(attempts);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lastError = "interrupted";
            phase = Phase.ABANDONED;
            return;
        }
        if (result.success()) {
            lastError = null;
            phase = Phase.SUCCEEDED;
        } else {
            lastError = result.reason();
            phase = attempts >= policy.maxAttempts() ? Phase.EXHAUSTED : Phase.WAITING;
        }
    }

    private void waitBeforeNextAttempt() {
        try {
            sleeper.sleep(policy.delayAfterAttempt(attempts));
            phase = Phase.ATTEMPTING;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            phase = Phase.ABANDONED;
        }
    }
}
