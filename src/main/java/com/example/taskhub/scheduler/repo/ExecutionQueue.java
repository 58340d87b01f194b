package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionRequest;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Durable "fire at" queue of execution requests. Requests are written by {@link JobStore#openExecution}
 * and {@link JobStore#openRetry}; this side only claims and settles them.
 */
public interface ExecutionQueue {

    /** Claims one READY request whose {@code notBefore <= now}. */
    Optional<ExecutionRequest> poll(String owner, Instant now);

    void acknowledge(Long requestId);

    /** Hands a claimed request back, to be picked again not before {@code notBefore}. */
    void release(Long requestId, Instant notBefore);

    void heartbeat(Collection<Long> requestIds, Instant now);

    /** Makes CLAIMED requests whose last heartbeat is before {@code claimedBefore} READY again. */
    int requeueExpired(Instant claimedBefore);
}
