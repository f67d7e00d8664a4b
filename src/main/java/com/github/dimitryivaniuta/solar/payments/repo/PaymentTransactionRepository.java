package com.github.dimitryivaniuta.solar.payments.repo;

import com.github.dimitryivaniuta.solar.payments.domain.PaymentTransaction;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for the append-only {@link PaymentTransaction} rows.
 */
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, String> {

    List<PaymentTransaction> findByPaymentIdOrderByCreatedAtAsc(String paymentId);
}
