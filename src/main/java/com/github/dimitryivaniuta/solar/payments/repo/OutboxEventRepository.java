package com.github.dimitryivaniuta.solar.payments.repo;

import com.github.dimitryivaniuta.solar.payments.domain.OutboxEvent;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link OutboxEvent}.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Locks the next batch of commands ready to be dispatched.
     *
     * <p>Uses Postgres {@code FOR UPDATE SKIP LOCKED} so several instances can run the dispatcher:
     * each command is handled by at most one instance at a time.</p>
     *
     * @param statuses statuses to fetch (NEW, RETRY)
     * @param now      current timestamp
     * @param limit    batch size
     * @return locked batch
     */
    @Query(value = """
            select *
            from outbox_events
            where status in (:statuses)
              and (next_attempt_at is null or next_attempt_at <= :now)
            order by created_at
            for update skip locked
            limit :limit
            """, nativeQuery = true)
    List<OutboxEvent> lockNextBatchForPublish(
            @Param("statuses") List<String> statuses,
            @Param("now") Instant now,
            @Param("limit") int limit
    );

    /**
     * Locks one command; used by the post-commit dispatch so it never races the scheduled worker.
     *
     * @param id command id
     * @return locked command
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from OutboxEvent e where e.id = :id")
    Optional<OutboxEvent> findByIdForUpdate(@Param("id") String id);

    List<OutboxEvent> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}
