package com.unifiedinbox.service;

import com.unifiedinbox.dto.ErrorKind;
import com.unifiedinbox.dto.RetryDecision;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decides what happens after a failed sync attempt. Attempts count from 0.
 */
@Component
public class SyncRetryPolicy {

    private static final int MAX_EXPONENT = 20;

    private final Duration baseDelay;
    private final int maxAttempts;

    public SyncRetryPolicy(@Value("${sync.retry.base-delay:PT1M}") Duration baseDelay,
                           @Value("${sync.retry.max-attempts:3}") int maxAttempts) {
        this.baseDelay = baseDelay;
        this.maxAttempts = maxAttempts;
    }

    public RetryDecision decide(ErrorKind kind, int attempt) {
        if (kind == null) {
            return RetryDecision.abandon();
        }
        return switch (kind) {
            case AUTH_EXPIRED -> RetryDecision.deactivate();
            case PERMANENT -> RetryDecision.abandon();
            case TRANSIENT -> attempt < maxAttempts
                ? RetryDecision.retryAfter(backoff(attempt))
                : RetryDecision.abandon();
        };
    }

    /**
     * {@code base * 2^attempt}
     */
    public Duration backoff(int attempt) {
        int exponent = Math.max(0, Math.min(attempt, MAX_EXPONENT));
        return baseDelay.multipliedBy(1L << exponent);
    }
}
