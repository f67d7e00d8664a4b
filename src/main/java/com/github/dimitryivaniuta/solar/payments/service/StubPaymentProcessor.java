package com.github.dimitryivaniuta.solar.payments.service;

import com.github.dimitryivaniuta.solar.payments.domain.Money;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Gateway stand-in used until a real PSP is wired in.
 *
 * <p>Always approves and returns a unique {@code PAY-} reference.</p>
 */
@Component
public class StubPaymentProcessor implements PaymentProcessor {

    private static final Logger log = LoggerFactory.getLogger(StubPaymentProcessor.class);

    static final String REFERENCE_PREFIX = "PAY";

    private final Clock clock;

    public StubPaymentProcessor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public GatewayResult charge(String payerId, Money amount, String description) {
        String reference = PaymentCalculator.generateReference(REFERENCE_PREFIX, clock.instant());
        log.info("Stub gateway approved charge. payerId={} amount={} reference={} description={}",
                payerId, amount, reference, description);
        return GatewayResult.approved(reference);
    }
}
