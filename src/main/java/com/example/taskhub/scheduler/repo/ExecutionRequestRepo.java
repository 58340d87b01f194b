package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionRequest;
import com.example.taskhub.scheduler.domain.RequestStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;

@Repository
public interface ExecutionRequestRepo extends JpaRepository<ExecutionRequest, Long> {

    @Query("select r.id from ExecutionRequest r where r.status = :status and r.notBefore <= :now order by r.notBefore asc, r.id asc")
    List<Long> findReadyIds(@Param("status") RequestStatus status, @Param("now") Timestamp now, Pageable page);

    /**
     * READY -> CLAIMED，仅当仍为 READY 时成功（返回 1）。
     */
    @Modifying(clearAutomatically = true)
    @Query("update ExecutionRequest r set r.status = :claimed, r.owner = :owner, r.heartbeatAt = :now "
            + "where r.id = :id and r.status = :ready")
    int markClaimed(@Param("id") Long id, @Param("owner") String owner, @Param("now") Timestamp now,
                    @Param("ready") RequestStatus ready, @Param("claimed") RequestStatus claimed);

    @Modifying(clearAutomatically = true)
    @Query("update ExecutionRequest r set r.status = :status where r.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") RequestStatus status);

    @Modifying(clearAutomatically = true)
    @Query("update ExecutionRequest r set r.status = :ready, r.owner = null, r.notBefore = :notBefore "
            + "where r.id = :id and r.status = :claimed")
    int release(@Param("id") Long id, @Param("notBefore") Timestamp notBefore,
                @Param("ready") RequestStatus ready, @Param("claimed") RequestStatus claimed);

    @Modifying(clearAutomatically = true)
    @Query("update ExecutionRequest r set r.heartbeatAt = :now where r.id in :ids and r.status = :claimed")
    int heartbeat(@Param("ids") Collection<Long> ids, @Param("now") Timestamp now, @Param("claimed") RequestStatus claimed);

    @Modifying(clearAutomatically = true)
    @Query("update ExecutionRequest r set r.status = :ready, r.owner = null "
            + "where r.status = :claimed and r.heartbeatAt < :before")
    int requeueExpired(@Param("before") Timestamp before, @Param("ready") RequestStatus ready,
                       @Param("claimed") RequestStatus claimed);
}
