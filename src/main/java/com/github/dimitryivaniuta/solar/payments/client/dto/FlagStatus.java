package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Risk flag the identity service keeps per user. Unknown values read as {@link #UNKNOWN}.
 */
public enum FlagStatus {
    GREEN,
    YELLOW,
    RED,
    @JsonEnumDefaultValue
    UNKNOWN
}
