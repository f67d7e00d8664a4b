package com.github.dimitryivaniuta.solar.payments.client.dto;

/**
 * Body of the project status update.
 *
 * @param status new project status
 */
public record ProjectStatusUpdate(String status) {}
