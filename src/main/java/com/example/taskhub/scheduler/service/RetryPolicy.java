package com.example.taskhub.scheduler.service;

/**
 * Stateless strategy consulted by the Dispatcher after a failed attempt.
 */
public interface RetryPolicy {

    /**
     * @param attempt 1-based number of the attempt that just failed
     * @param error   failure of that attempt
     */
    RetryDecision decide(int attempt, Throwable error);
}
