package com.github.dimitryivaniuta.solar.payments.service.dto;

import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;

/**
 * Method selection input after decimal normalization.
 *
 * @param method        chosen method
 * @param declaredTotal total sent by the client, or null to use the project cost
 * @param downpayment   downpayment, or null
 * @param installments  number of installments (BNPL), or null
 */
public record SelectMethodCommand(PaymentMethod method, Money declaredTotal, Money downpayment, Integer installments) {}
