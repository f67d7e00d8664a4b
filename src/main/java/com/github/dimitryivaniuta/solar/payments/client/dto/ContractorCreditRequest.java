package com.github.dimitryivaniuta.solar.payments.client.dto;

import java.math.BigDecimal;

/**
 * Body of the contractor balance credit. The contractor service dedupes on {@code reference}.
 *
 * @param amount    amount to add
 * @param reference payout reference
 * @param projectId project id
 */
public record ContractorCreditRequest(BigDecimal amount, String reference, String projectId) {}
