package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.github.dimitryivaniuta.solar.payments.domain.Money;

/**
 * Financing standing of a payer.
 *
 * @param userId        user id
 * @param creditBalance available financing credit
 * @param flagStatus    risk flag
 */
public record LedgerProfile(String userId, Money creditBalance, FlagStatus flagStatus) {}
