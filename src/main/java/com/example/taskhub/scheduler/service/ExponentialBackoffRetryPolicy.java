package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.domain.ErrorKind;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * delay = base * 2^(attempt-1)，上限 maxDelay；attempt 达到 maxAttempts 后放弃。
 * UNKNOWN_TASK / PARAMETER_VALIDATION 永不重试。
 */
@Getter
@ToString
public class ExponentialBackoffRetryPolicy implements RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;

    public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must be >= 0");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public RetryDecision decide(int attempt, Throwable error) {
        if (!ErrorKind.of(error).isRetryable()) {
            return RetryDecision.giveUp();
        }
        if (attempt >= maxAttempts) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retryAfter(delayFor(attempt));
    }

    Duration delayFor(int attempt) {
        int shift = Math.max(0, attempt - 1);
        long baseMs = baseDelay.toMillis();
        // 防溢出：超过 62 位直接取上限
        if (shift >= 62 || baseMs > (Long.MAX_VALUE >> shift)) {
            return maxDelay;
        }
        long ms = baseMs << shift;
        return ms > maxDelay.toMillis() ? maxDelay : Duration.ofMillis(ms);
    }
}
