package com.github.dimitryivaniuta.solar.payments.client.dto;

import java.math.BigDecimal;

/**
 * Body of {@code PATCH /api/users/{id}/sama-credit}.
 *
 * @param amount    positive amount
 * @param operation deduct or add
 * @param projectId project the adjustment belongs to
 * @param reason    audit text
 */
public record CreditAdjustmentRequest(BigDecimal amount, CreditOperation operation, String projectId, String reason) {}
