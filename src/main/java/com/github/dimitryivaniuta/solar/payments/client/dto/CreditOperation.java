package com.github.dimitryivaniuta.solar.payments.client.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum CreditOperation {
    DEDUCT,
    ADD;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
