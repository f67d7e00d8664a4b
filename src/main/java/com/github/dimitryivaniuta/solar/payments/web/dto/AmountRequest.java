package com.github.dimitryivaniuta.solar.payments.web.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Downpayment request.
 *
 * @param amount amount to pay
 */
public record AmountRequest(@NotNull @Positive @Digits(integer = 13, fraction = 2) BigDecimal amount) {}
