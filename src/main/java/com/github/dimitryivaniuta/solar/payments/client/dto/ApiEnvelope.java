package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response envelope used by the marketplace services: {@code {success, message, data}}.
 *
 * @param success whether the remote call succeeded
 * @param message optional message
 * @param data    payload
 * @param <T>     payload type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiEnvelope<T>(boolean success, String message, T data) {}
