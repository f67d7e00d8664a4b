package com.github.dimitryivaniuta.solar.payments.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Admin payout request.
 *
 * @param amount                  amount released
 * @param paymentReference        payout reference; generated when absent
 * @param notes                   admin notes
 * @param contractorBankName      bank name
 * @param contractorIban          IBAN
 * @param contractorAccountHolder account holder
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReleasePaymentRequest(
        @NotNull @Positive @Digits(integer = 13, fraction = 2) BigDecimal amount,
        @Size(max = 64) String paymentReference,
        @Size(max = 500) String notes,
        @Size(max = 128) String contractorBankName,
        @Size(max = 64) String contractorIban,
        @Size(max = 128) String contractorAccountHolder
) {}
