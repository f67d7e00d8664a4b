package com.github.dimitryivaniuta.solar.payments.service;

import java.util.Collection;
import java.util.Locale;

/**
 * Caller identity as forwarded by the upstream gateway.
 *
 * @param userId    caller id
 * @param role      caller role, e.g. {@code user}, {@code admin}
 * @param authToken raw Authorization header, forwarded to the identity service; may be null
 */
public record Actor(String userId, String role, String authToken) {

    public boolean hasAnyRole(Collection<String> roles) {
        if (role == null) {
            return false;
        }
        String normalized = role.toLowerCase(Locale.ROOT);
        return roles.stream().anyMatch(r -> r.equalsIgnoreCase(normalized));
    }
}
