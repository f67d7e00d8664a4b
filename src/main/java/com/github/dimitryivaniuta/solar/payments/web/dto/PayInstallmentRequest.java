package com.github.dimitryivaniuta.solar.payments.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PayInstallmentRequest(
        @NotBlank String installmentId,
        @NotNull @Positive @Digits(integer = 13, fraction = 2) BigDecimal amount
) {}
