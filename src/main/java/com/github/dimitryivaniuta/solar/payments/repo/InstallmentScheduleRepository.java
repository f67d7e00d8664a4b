package com.github.dimitryivaniuta.solar.payments.repo;

import com.github.dimitryivaniuta.solar.payments.domain.InstallmentSchedule;
import com.github.dimitryivaniuta.solar.payments.domain.InstallmentStatus;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link InstallmentSchedule}.
 */
public interface InstallmentScheduleRepository extends JpaRepository<InstallmentSchedule, String> {

    @Query("select s from InstallmentSchedule s where s.payment.id = :paymentId order by s.installmentNumber")
    List<InstallmentSchedule> findByPaymentIdOrdered(@Param("paymentId") String paymentId);

    /**
     * Loads an installment together with its payment.
     *
     * @param installmentId installment id
     * @return installment with payment fetched
     */
    @Query("select s from InstallmentSchedule s join fetch s.payment where s.id = :id")
    Optional<InstallmentSchedule> findWithPayment(@Param("id") String installmentId);

    /**
     * Counts installments of a payment not in the given status. Run inside the mutating transaction.
     *
     * @param paymentId payment id
     * @param status    status to exclude (PAID)
     * @return count
     */
    @Query("select count(s) from InstallmentSchedule s where s.payment.id = :paymentId and s.status <> :status")
    long countByPaymentIdAndStatusNot(@Param("paymentId") String paymentId, @Param("status") InstallmentStatus status);
}
