package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

/**
 * Project facts the payment flow needs.
 *
 * @param id           project id
 * @param ownerId      project owner (the payer)
 * @param contractorId assigned contractor, may be null
 * @param status       project status, may be null
 * @param cost         agreed project cost, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectInfo(
        String id,
        @JsonAlias("user_id") String ownerId,
        String contractorId,
        String status,
        @JsonAlias("total_cost") BigDecimal cost
) {

    public boolean isOwnedBy(String userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
