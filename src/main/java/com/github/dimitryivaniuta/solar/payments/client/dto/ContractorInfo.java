package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Contractor as returned by the contractor service.
 *
 * @param id   contractor id
 * @param name business name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContractorInfo(String id, @JsonAlias({"business_name", "businessName"}) String name) {}
