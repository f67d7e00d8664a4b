package com.github.dimitryivaniuta.solar.payments.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

/**
 * Method selection request.
 *
 * @param paymentMethod        {@code single_pay} or {@code bnpl}
 * @param totalAmount          total; when absent the project cost is used
 * @param downpaymentAmount    BNPL downpayment, may be absent or zero
 * @param numberOfInstallments BNPL installments (3..24)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SelectMethodRequest(
        @NotNull PaymentMethod paymentMethod,
        @Positive @Digits(integer = 13, fraction = 2) BigDecimal totalAmount,
        @Digits(integer = 13, fraction = 2) BigDecimal downpaymentAmount,
        Integer numberOfInstallments
) {}
