package com.delta.jobharvest.crawl.retry;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.model.Classification;
import com.delta.jobharvest.crawl.model.CrawlTask;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Turns a classification into the next step for a task. Blocks and transport errors are retried
 * with capped exponential backoff until {@code maxAttempts} retries have been spent.
 */
public class RetryBackoffController {
    static final double JITTER_MIN = 0.5;
    static final double JITTER_MAX = 1.3;

    private final int maxAttempts;
    private final long baseMs;
    private final long capMs;
    private final DoubleSupplier jitter;

    public RetryBackoffController(int maxAttempts, HarvestProperties.Backoff backoff) {
        this(
            maxAttempts,
            backoff.getBaseMs(),
            backoff.getCapMs(),
            () -> ThreadLocalRandom.current().nextDouble(JITTER_MIN, JITTER_MAX)
        );
    }

    public RetryBackoffController(int maxAttempts, long baseMs, long capMs, DoubleSupplier jitter) {
        this.maxAttempts = Math.max(0, maxAttempts);
        this.baseMs = Math.max(1, baseMs);
        this.capMs = Math.max(this.baseMs, capMs);
        this.jitter = jitter;
    }

    public BackoffDecision decide(CrawlTask task, Classification classification) {
        if (classification == Classification.OK) {
            return BackoffDecision.proceed();
        }
        IdentityAction action = switch (classification) {
            case HARD_BLOCK -> IdentityAction.RETIRE;
            case SOFT_BLOCK -> IdentityAction.REFRESH_COOKIES;
            default -> IdentityAction.KEEP;
        };
        if (task.attempt() >= maxAttempts) {
            return BackoffDecision.abandon(action);
        }
        return BackoffDecision.retry(delayFor(task.attempt()), action);
    }

    public Duration delayFor(int attempt) {
        double factor = clampJitter(jitter.getAsDouble());
        double exponential = baseMs * Math.pow(2, Math.max(0, Math.min(attempt, 30))) * factor;
        long delayMs = (long) Math.min(capMs, exponential);
        return Duration.ofMillis(Math.max(0, delayMs));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private double clampJitter(double value) {
        if (Double.isNaN(value) || value < JITTER_MIN) {
            return JITTER_MIN;
        }
        return Math.min(value, Math.nextDown(JITTER_MAX));
    }
}
