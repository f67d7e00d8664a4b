package com.github.dimitryivaniuta.solar.payments.service.dto;

import com.github.dimitryivaniuta.solar.payments.domain.ContractorPayout;
import com.github.dimitryivaniuta.solar.payments.domain.Money;

/**
 * Admin payout to the contractor.
 *
 * @param amount    amount released
 * @param reference payout reference, or null to generate one
 * @param notes     admin notes, or null
 * @param payout    bank details, or null
 */
public record ReleaseCommand(Money amount, String reference, String notes, ContractorPayout payout) {}
