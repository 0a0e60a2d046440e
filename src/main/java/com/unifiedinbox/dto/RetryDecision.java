package com.unifiedinbox.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

@Data
@AllArgsConstructor
public class RetryDecision {

    public enum Action {
        RETRY,
        ABANDON,
        DEACTIVATE
    }

    private Action action;
    // Only set for RETRY
    private Duration delay;

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(Action.RETRY, delay);
    }

    public static RetryDecision abandon() {
        return new RetryDecision(Action.ABANDON, null);
    }

    public static RetryDecision deactivate() {
        return new RetryDecision(Action.DEACTIVATE, null);
    }
}
