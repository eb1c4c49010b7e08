package com.delta.jobharvest.crawl.retry;

import java.time.Duration;

public record BackoffDecision(
    Outcome outcome,
    Duration delay,
    IdentityAction identityAction
) {
    public enum Outcome {
        PROCEED,
        RETRY,
        ABANDON
    }

    public static BackoffDecision proceed() {
        return new BackoffDecision(Outcome.PROCEED, Duration.ZERO, IdentityAction.KEEP);
    }

    public static BackoffDecision retry(Duration delay, IdentityAction identityAction) {
        return new BackoffDecision(Outcome.RETRY, delay, identityAction);
    }

    public static BackoffDecision abandon(IdentityAction identityAction) {
        return new BackoffDecision(Outcome.ABANDON, Duration.ZERO, identityAction);
    }

    public boolean isProceed() {
        return outcome == Outcome.PROCEED;
    }

    public boolean isRetry() {
        return outcome == Outcome.RETRY;
    }

    public boolean isAbandon() {
        return outcome == Outcome.ABANDON;
    }
}
