package com.github.dimitryivaniuta.solar.payments.service;

import com.github.dimitryivaniuta.solar.payments.domain.Money;

/**
 * Abstraction over the card/bank payment gateway.
 *
 * <p>Local runs and tests use {@link StubPaymentProcessor}.</p>
 */
public interface PaymentProcessor {

    /**
     * Charges the payer.
     *
     * @param payerId     payer id
     * @param amount      amount to charge
     * @param description statement text
     * @return gateway outcome; never null
     */
    GatewayResult charge(String payerId, Money amount, String description);

    /**
     * Gateway outcome.
     *
     * @param success   whether the charge went through
     * @param reference gateway transaction reference (set on success)
     * @param reason    decline reason (set on failure)
     */
    record GatewayResult(boolean success, String reference, String reason) {

        public static GatewayResult approved(String reference) {
            return new GatewayResult(true, reference, null);
        }

        public static GatewayResult declined(String reason) {
            return new GatewayResult(false, null, reason);
        }
    }
}
