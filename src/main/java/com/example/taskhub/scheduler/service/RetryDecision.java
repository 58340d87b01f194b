package com.example.taskhub.scheduler.service;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

@Getter
@ToString
@EqualsAndHashCode
public final class RetryDecision {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    private final boolean retry;
    private final Duration delay;

    private RetryDecision(boolean retry, Duration delay) {
        this.retry = retry;
        this.delay = delay;
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("retry delay must be >= 0");
        }
        return new RetryDecision(true, delay);
    }
}
