package com.github.dimitryivaniuta.solar.payments.service;

import com.github.dimitryivaniuta.solar.payments.config.CacheConfig;
import com.github.dimitryivaniuta.solar.payments.domain.Payment;
import com.github.dimitryivaniuta.solar.payments.exception.NotFoundException;
import com.github.dimitryivaniuta.solar.payments.repo.InstallmentScheduleRepository;
import com.github.dimitryivaniuta.solar.payments.repo.PaymentRepository;
import com.github.dimitryivaniuta.solar.payments.repo.PaymentTransactionRepository;
import com.github.dimitryivaniuta.solar.payments.service.dto.InstallmentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentDetailsView;
import com.github.dimitryivaniuta.solar.payments.service.dto.PaymentView;
import com.github.dimitryivaniuta.solar.payments.service.dto.TransactionView;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side: payment details (cached) and installment lists. No authorization here.
 */
@Service
public class PaymentQueryService {

    private static final Logger log = LoggerFactory.getLogger(PaymentQueryService.class);

    private final PaymentRepository paymentRepository;
    private final InstallmentScheduleRepository installmentRepository;
    private final PaymentTransactionRepository transactionRepository;

    public PaymentQueryService(PaymentRepository paymentRepository,
                               InstallmentScheduleRepository installmentRepository,
                               PaymentTransactionRepository transactionRepository) {
        this.paymentRepository = paymentRepository;
        this.installmentRepository = installmentRepository;
        this.transactionRepository = transactionRepository;
    }

    /**
     * Payment with installments and transactions.
     *
     * @param projectId project id
     * @return details
     * @throws NotFoundException if the project has no payment
     */
    @Cacheable(cacheNames = CacheConfig.PAYMENT_DETAILS_CACHE, key = "#projectId")
    @Transactional(readOnly = true)
    public PaymentDetailsView loadDetails(String projectId) {
        Payment payment = paymentRepository.findByProjectId(projectId)
                .orElseThrow(() -> new NotFoundException("Payment not found for this project"));
        List<InstallmentView> installments = installmentRepository.findByPaymentIdOrdered(payment.getId()).stream()
                .map(InstallmentView::from)
                .toList();
        List<TransactionView> transactions = transactionRepository.findByPaymentIdOrderByCreatedAtAsc(payment.getId()).stream()
                .map(TransactionView::from)
                .toList();
        return new PaymentDetailsView(PaymentView.from(payment), installments, transactions);
    }

    /**
     * Installments of the project's payment, ordered by number.
     *
     * @param projectId project id
     * @return installments, or empty when there is no payment (or it is single pay)
     */
    @Transactional(readOnly = true)
    public Optional<PaymentInstallments> findInstallments(String projectId) {
        return paymentRepository.findByProjectId(projectId)
                .map(p -> new PaymentInstallments(p.getPayerId(), installmentRepository.findByPaymentIdOrdered(p.getId()).stream()
                        .map(InstallmentView::from)
                        .toList()));
    }

    /**
     * Drops the cached details of a project. Called after every committed mutation.
     *
     * @param projectId project id
     */
    @CacheEvict(cacheNames = CacheConfig.PAYMENT_DETAILS_CACHE, key = "#projectId")
    public void evictDetails(String projectId) {
        log.debug("Payment details evicted. projectId={}", projectId);
    }

    /**
     * Installments together with the payer they belong to.
     *
     * @param payerId      payer id
     * @param installments installments ordered by number
     */
    public record PaymentInstallments(String payerId, List<InstallmentView> installments) {}
}
