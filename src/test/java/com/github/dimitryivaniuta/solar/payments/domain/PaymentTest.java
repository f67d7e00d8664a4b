package com.github.dimitryivaniuta.solar.payments.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PaymentTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private static InstallmentPlan plan(String... amounts) {
        LocalDate start = LocalDate.of(2025, 3, 1);
        List<InstallmentPlan.Item> items = new ArrayList<>();
        Money sum = Money.ZERO;
        for (int i = 0; i < amounts.length; i++) {
            Money m = Money.of(amounts[i]);
            sum = sum.plus(m);
            items.add(new InstallmentPlan.Item(i + 1, m, start.plusMonths(i + 1)));
        }
        return new InstallmentPlan(sum, Money.of(amounts[0]), items);
    }

    private static Payment bnpl(String total, String down, InstallmentPlan plan) {
        return Payment.newBnpl("proj-1", "user-1", "contractor-1", Money.of(total), Money.of(down), plan,
                plan.principal(), "BNPL-TEST-000001", NOW);
    }

    private static void assertConserved(Payment p) {
        Assertions.assertEquals(p.getTotalAmount(), p.getPaidAmount().plus(p.getRemainingAmount()));
    }

    @Test
    void singlePayStartsPendingWithNothingPaid() {
        Payment p = Payment.newSinglePay("proj-1", "user-1", null, Money.of("5000.00"), "SPY-TEST-000001", NOW);

        Assertions.assertEquals(PaymentStatus.PENDING, p.getPaymentStatus());
        Assertions.assertEquals(Money.ZERO, p.getPaidAmount());
        Assertions.assertEquals(Money.of("5000.00"), p.getRemainingAmount());
        Assertions.assertTrue(p.getInstallments().isEmpty());
        assertConserved(p);
    }

    @Test
    void fullPaymentCompletesAndKeepsExcessOutOfPrincipal() {
        Payment p = Payment.newSinglePay("proj-1", "user-1", null, Money.of("5000.00"), "SPY-TEST-000001", NOW);

        Money excess = p.applyFullPayment(Money.of("5100.00"), NOW);

        Assertions.assertEquals(Money.of("100.00"), excess);
        Assertions.assertEquals(PaymentStatus.COMPLETED, p.getPaymentStatus());
        Assertions.assertEquals(Money.of("5000.00"), p.getPaidAmount());
        Assertions.assertEquals(Money.ZERO, p.getRemainingAmount());
        Assertions.assertEquals(Money.of("100.00"), p.getFeesPaidAmount());
        Assertions.assertEquals(NOW, p.getCompletedAt());
        assertConserved(p);
    }

    @Test
    void fullPaymentTwiceIsRejected() {
        Payment p = Payment.newSinglePay("proj-1", "user-1", null, Money.of("5000.00"), "SPY-TEST-000001", NOW);
        p.applyFullPayment(Money.of("5000.00"), NOW);

        Assertions.assertThrows(IllegalStateException.class, () -> p.applyFullPayment(Money.of("5000.00"), NOW));
        Assertions.assertEquals(Money.of("5000.00"), p.getPaidAmount());
    }

    @Test
    void bnplRejectsScheduleThatDoesNotAddUp() {
        InstallmentPlan wrong = plan("1000.00", "1000.00", "1000.00");
        Assertions.assertThrows(IllegalStateException.class, () -> bnpl("5000.00", "1000.00", wrong));
    }

    @Test
    void downpaymentThenInstallmentsCompleteThePayment() {
        Payment p = bnpl("12000.00", "2000.00", plan("2000.00", "2000.00", "2000.00", "2000.00", "2000.00"));
        Assertions.assertEquals(5, p.getInstallments().size());
        Assertions.assertTrue(p.isDownpaymentOutstanding());

        p.applyDownpayment(Money.of("2000.00"), NOW);
        Assertions.assertEquals(PaymentStatus.PARTIALLY_PAID, p.getPaymentStatus());
        Assertions.assertFalse(p.isDownpaymentOutstanding());
        assertConserved(p);

        for (int i = 0; i < 5; i++) {
            InstallmentSchedule s = p.getInstallments().get(i);
            s.markPaid(Money.of("2000.00"), 0, Money.ZERO, "PAY-" + i, NOW);
            Money restored = p.applyInstallment(s, Money.of("2000.00"), 4 - i, NOW);
            Assertions.assertEquals(Money.of("2000.00"), restored);
            assertConserved(p);
        }

        Assertions.assertEquals(PaymentStatus.COMPLETED, p.getPaymentStatus());
        Assertions.assertEquals(Money.ZERO, p.getRemainingAmount());
        Assertions.assertEquals(Money.ZERO, p.outstandingCreditHold());
    }

    @Test
    void lateFeeGoesToFeesNotPrincipal() {
        Payment p = bnpl("6000.00", "0.00", plan("2000.00", "2000.00", "2000.00"));
        InstallmentSchedule first = p.getInstallments().get(0);

        first.markPaid(Money.of("2040.00"), 10, Money.of("40.00"), "PAY-1", NOW);
        Money restored = p.applyInstallment(first, Money.of("2040.00"), 2, NOW);

        Assertions.assertEquals(Money.of("2000.00"), restored);
        Assertions.assertEquals(Money.of("2000.00"), p.getPaidAmount());
        Assertions.assertEquals(Money.of("40.00"), p.getFeesPaidAmount());
        Assertions.assertEquals(PaymentStatus.PARTIALLY_PAID, p.getPaymentStatus());
        Assertions.assertTrue(first.isOverdue());
        assertConserved(p);
    }

    @Test
    void installmentCannotBePaidTwice() {
        Payment p = bnpl("6000.00", "0.00", plan("2000.00", "2000.00", "2000.00"));
        InstallmentSchedule first = p.getInstallments().get(0);
        first.markPaid(Money.of("2000.00"), 0, Money.ZERO, "PAY-1", NOW);

        Assertions.assertThrows(IllegalStateException.class,
                () -> first.markPaid(Money.of("2000.00"), 0, Money.ZERO, "PAY-2", NOW));
        Assertions.assertEquals("PAY-1", first.getPaymentReference());
    }

    @Test
    void downpaymentMustMatchExactly() {
        Payment p = bnpl("12000.00", "2000.00", plan("2000.00", "2000.00", "2000.00", "2000.00", "2000.00"));
        Assertions.assertThrows(IllegalStateException.class, () -> p.applyDownpayment(Money.of("1999.99"), NOW));
        Assertions.assertEquals(Money.ZERO, p.getPaidAmount());
    }

    @Test
    void releaseToContractorHappensOnce() {
        Payment p = Payment.newSinglePay("proj-1", "user-1", "contractor-1", Money.of("5000.00"), "SPY-TEST-000001", NOW);
        ContractorPayout payout = new ContractorPayout("Bank", "SA0000", "Holder");

        p.markReleasedToContractor(Money.of("4500.00"), "ADM-1", "first", payout, "admin-1", NOW);

        Assertions.assertTrue(p.isAdminPaidContractor());
        Assertions.assertEquals("ADM-1", p.getAdminPaymentReference());
        Assertions.assertThrows(IllegalStateException.class,
                () -> p.markReleasedToContractor(Money.of("4500.00"), "ADM-2", "again", payout, "admin-1", NOW));
        Assertions.assertEquals("ADM-1", p.getAdminPaymentReference());
    }

    @Test
    void statusNeverMovesBackwards() {
        Assertions.assertTrue(PaymentStatus.PENDING.canMoveTo(PaymentStatus.PARTIALLY_PAID));
        Assertions.assertTrue(PaymentStatus.PARTIALLY_PAID.canMoveTo(PaymentStatus.PARTIALLY_PAID));
        Assertions.assertFalse(PaymentStatus.COMPLETED.canMoveTo(PaymentStatus.PARTIALLY_PAID));
        Assertions.assertFalse(PaymentStatus.PARTIALLY_PAID.canMoveTo(PaymentStatus.PENDING));
    }
}
