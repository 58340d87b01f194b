package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Job and execution counters over the whole store.
 * <p>
 * {@code successRate} is the percentage of SUCCEEDED among the executions that reached a final
 * outcome (SUCCEEDED or FAILED); RETRYING attempts and cancelled runs are not counted. It is null
 * while nothing has finished.
 */
@Getter
@Builder
@ToString
public class JobStatistics {
    /** non-archived jobs, ACTIVE */
    private final long activeJobs;
    /** non-archived jobs, PAUSED */
    private final long pausedJobs;
    private final long archivedJobs;
    /** non-archived jobs whose cron firings are no longer enqueued */
    private final long exhaustedJobs;
    /** every status present, zero when no log has it */
    private final Map<ExecutionStatus, Long> executionsByStatus;
    /** mean run time of attempts that started and finished */
    private final Double averageDurationMs;

    public long getTotalJobs() {
        return activeJobs + pausedJobs + archivedJobs;
    }

    public long getTotalExecutions() {
        long total = 0;
        for (Long n : executionsByStatus.values()) total += n;
        return total;
    }

    public Double getSuccessRate() {
        long succeeded = executionsByStatus.getOrDefault(ExecutionStatus.SUCCEEDED, 0L);
        long failed = executionsByStatus.getOrDefault(ExecutionStatus.FAILED, 0L);
        if (succeeded + failed == 0) return null;
        return BigDecimal.valueOf(succeeded * 100L)
                .divide(BigDecimal.valueOf(succeeded + failed), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
