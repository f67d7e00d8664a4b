package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;

/**
 * Part of the identity service user payload the payment flow reads.
 *
 * @param id               user id
 * @param flagStatus       risk flag (may be absent)
 * @param samaCreditAmount available financing credit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserResponse(String id, FlagStatus flagStatus, BigDecimal samaCreditAmount) {}
