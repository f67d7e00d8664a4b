package com.github.dimitryivaniuta.solar.payments.repo;

import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link Payment}.
 */
public interface PaymentRepository extends JpaRepository<Payment, String> {

    Optional<Payment> findByProjectId(String projectId);

    boolean existsByProjectId(String projectId);

    /**
     * Finds the payment of a project and locks its row for the rest of the transaction.
     *
     * <p>Every mutation goes through this lookup and re-checks its preconditions afterwards, so two concurrent
     * requests against the same payment are applied one after the other.</p>
     *
     * @param projectId project id
     * @return locked payment
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Payment p where p.projectId = :projectId")
    Optional<Payment> findByProjectIdForUpdate(@Param("projectId") String projectId);
}
