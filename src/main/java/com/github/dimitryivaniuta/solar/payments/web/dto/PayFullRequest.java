package com.github.dimitryivaniuta.solar.payments.web.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Full payment request; an absent amount means "the total".
 *
 * @param amount amount to pay or null
 */
public record PayFullRequest(@Positive @Digits(integer = 13, fraction = 2) BigDecimal amount) {}
