package com.github.dimitryivaniuta.solar.payments.service.dto;

import java.util.List;

/**
 * Payment with its schedule and transaction history. Cached in Redis per project.
 *
 * @param payment      payment
 * @param installments installments ordered by number (empty for single pay)
 * @param transactions transactions oldest first
 */
public record PaymentDetailsView(PaymentView payment, List<InstallmentView> installments, List<TransactionView> transactions) {}
