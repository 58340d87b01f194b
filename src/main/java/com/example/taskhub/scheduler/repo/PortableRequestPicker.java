package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.RequestStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * 默认实现（H2 等）：不加行锁，先读最早到期的一条，再靠 markClaimed 的条件更新抢占。
 * 并发实例抢同一条时只有一个 markClaimed 返回 1，其余本轮空手而归。
 */
@Repository
@Profile("!mysql & !db2")
@RequiredArgsConstructor
public class PortableRequestPicker implements RequestPicker {

    private final ExecutionRequestRepo requestRepo;

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> lockOneReadyId(Timestamp now) {
        List<Long> ids = requestRepo.findReadyIds(RequestStatus.READY, now, PageRequest.of(0, 1));
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    @Transactional
    public int markClaimed(Long id, String owner, Timestamp now) {
        return requestRepo.markClaimed(id, owner, now, RequestStatus.READY, RequestStatus.CLAIMED);
    }
}
