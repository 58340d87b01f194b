package com.example.taskhub.scheduler.repo;

import java.sql.Timestamp;
import java.util.Optional;

/**
 * Picks one due execution request. Implementations differ per database; all of them finish with the
 * conditional READY -> CLAIMED update so two workers never take the same request.
 */
public interface RequestPicker {
    Optional<Long> lockOneReadyId(Timestamp now);

    int markClaimed(Long id, String owner, Timestamp now);
}
