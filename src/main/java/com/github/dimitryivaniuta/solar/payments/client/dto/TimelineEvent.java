package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

/**
 * Project timeline entry.
 *
 * @param eventType     event type, e.g. {@code installment_paid}
 * @param title         short title
 * @param description   human readable description
 * @param createdById   actor id
 * @param createdByRole actor role
 * @param metadata      extra facts (amounts, references)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimelineEvent(
        String eventType,
        String title,
        String description,
        String createdById,
        String createdByRole,
        Map<String, Object> metadata
) {}
