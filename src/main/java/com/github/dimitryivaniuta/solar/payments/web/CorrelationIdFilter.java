package com.github.dimitryivaniuta.solar.payments.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Accepts or generates {@code X-Correlation-Id}, echoes it back and exposes it (with the caller id) in the MDC.
 *
 * <p>The remote clients read the MDC value and forward it, so one id follows a payment across services.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    /**
     * Header name for correlation id.
     */
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    /**
     * MDC key for the correlation id.
     */
    public static final String MDC_KEY = "correlationId";

    /**
     * MDC key for the caller id.
     */
    public static final String MDC_USER_KEY = "userId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = Optional.ofNullable(request.getHeader(CORRELATION_ID_HEADER))
                .map(String::trim)
                .filter(v -> ACCEPTED_ID.matcher(v).matches())
                .orElseGet(() -> UUID.randomUUID().toString());

        MDC.put(MDC_KEY, correlationId);
        String userId = request.getHeader(PaymentsController.USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            MDC.put(MDC_USER_KEY, userId.trim());
        }
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_USER_KEY);
        }
    }
}
