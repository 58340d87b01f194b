package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionRequest;
import com.example.taskhub.scheduler.domain.RequestStatus;
import com.example.taskhub.scheduler.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

@Slf4j
@Repository
public class JpaExecutionQueue implements ExecutionQueue {

    private final ExecutionRequestRepo requestRepo;
    private final RequestPicker picker;
    private final TransactionTemplate tx;

    public JpaExecutionQueue(ExecutionRequestRepo requestRepo, RequestPicker picker, PlatformTransactionManager txManager) {
        this.requestRepo = requestRepo;
        this.picker = picker;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * 原子领取：picker 选出一条（MySQL/DB2 下带 SKIP LOCKED 行锁）+ READY -> CLAIMED 条件更新
     */
    @Override
    public Optional<ExecutionRequest> poll(String owner, Instant now) {
        Timestamp ts = Timestamp.from(now);
        return inTx(s -> {
            Optional<Long> idOpt = picker.lockOneReadyId(ts);
            if (!idOpt.isPresent()) return Optional.<ExecutionRequest>empty();

            Long id = idOpt.get();
            int ok = picker.markClaimed(id, owner, ts);
            if (ok == 0) {
                // 被其它实例抢走
                return Optional.<ExecutionRequest>empty();
            }
            return requestRepo.findById(id);
        });
    }

    @Override
    public void acknowledge(Long requestId) {
        inTx(s -> requestRepo.updateStatus(requestId, RequestStatus.DONE));
    }

    @Override
    public void release(Long requestId, Instant notBefore) {
        inTx(s -> requestRepo.release(requestId, Timestamp.from(notBefore), RequestStatus.READY, RequestStatus.CLAIMED));
    }

    @Override
    public void heartbeat(Collection<Long> requestIds, Instant now) {
        if (requestIds == null || requestIds.isEmpty()) return;
        inTx(s -> requestRepo.heartbeat(requestIds, Timestamp.from(now), RequestStatus.CLAIMED));
    }

    @Override
    public int requeueExpired(Instant claimedBefore) {
        Integer n = inTx(s -> requestRepo.requeueExpired(Timestamp.from(claimedBefore), RequestStatus.READY, RequestStatus.CLAIMED));
        int count = n == null ? 0 : n;
        if (count > 0) {
            log.warn("Requeued {} execution request(s) whose claim lease expired before {}", count, claimedBefore);
        }
        return count;
    }

    private <T> T inTx(TransactionCallback<T> action) {
        try {
            return tx.execute(action);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Execution queue unavailable: " + e.getMessage(), e);
        }
    }
}
