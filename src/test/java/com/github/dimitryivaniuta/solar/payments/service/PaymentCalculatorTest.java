package com.github.dimitryivaniuta.solar.payments.service;

import com.github.dimitryivaniuta.solar.payments.domain.InstallmentPlan;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import com.github.dimitryivaniuta.solar.payments.exception.ValidationException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PaymentCalculatorTest {

    private static final LocalDate START = LocalDate.of(2025, 1, 31);
    private static final Money MIN = Money.of("100.00");

    @Test
    void evenSplitAfterDownpayment() {
        InstallmentPlan plan = PaymentCalculator.buildInstallmentSchedule(
                Money.of("12000.00"), Money.of("2000.00"), 5, START);

        Assertions.assertEquals(Money.of("10000.00"), plan.principal());
        Assertions.assertEquals(Money.of("2000.00"), plan.monthlyEmi());
        Assertions.assertEquals(5, plan.installments().size());
        plan.installments().forEach(i -> Assertions.assertEquals(Money.of("2000.00"), i.amount()));
    }

    @Test
    void lastInstallmentAbsorbsRemainder() {
        InstallmentPlan plan = PaymentCalculator.buildInstallmentSchedule(
                Money.of("1000.00"), Money.ZERO, 3, START);

        Assertions.assertEquals(Money.of("333.33"), plan.installments().get(0).amount());
        Assertions.assertEquals(Money.of("333.33"), plan.installments().get(1).amount());
        Assertions.assertEquals(Money.of("333.34"), plan.installments().get(2).amount());
        Assertions.assertEquals(plan.principal(), plan.sum());
    }

    @Test
    void scheduleAlwaysAddsUpToTotal() {
        Money total = Money.of("9999.99");
        Money down = Money.of("0.01");
        for (int n = 3; n <= 24; n++) {
            InstallmentPlan plan = PaymentCalculator.buildInstallmentSchedule(total, down, n, START);

            Assertions.assertEquals(n, plan.installments().size(), "count for n=" + n);
            Assertions.assertEquals(total, plan.sum().plus(down), "sum for n=" + n);
        }
    }

    @Test
    void dueDatesAreMonthlyFromStartAndClampToMonthEnd() {
        InstallmentPlan plan = PaymentCalculator.buildInstallmentSchedule(
                Money.of("3000.00"), Money.ZERO, 3, START);

        List<InstallmentPlan.Item> items = plan.installments();
        Assertions.assertEquals(1, items.get(0).number());
        Assertions.assertEquals(LocalDate.of(2025, 2, 28), items.get(0).dueDate());
        Assertions.assertEquals(LocalDate.of(2025, 3, 31), items.get(1).dueDate());
        Assertions.assertEquals(LocalDate.of(2025, 4, 30), items.get(2).dueDate());
    }

    @Test
    void scheduleRejectsOutOfRangeCounts() {
        Assertions.assertThrows(ValidationException.class,
                () -> PaymentCalculator.buildInstallmentSchedule(Money.of("1000.00"), Money.ZERO, 2, START));
        Assertions.assertThrows(ValidationException.class,
                () -> PaymentCalculator.buildInstallmentSchedule(Money.of("1000.00"), Money.ZERO, 25, START));
        Assertions.assertThrows(ValidationException.class,
                () -> PaymentCalculator.buildInstallmentSchedule(Money.of("1000.00"), Money.of("1000.01"), 3, START));
    }

    @Test
    void overdueDaysIsZeroBeforeDueDate() {
        LocalDate due = LocalDate.of(2025, 3, 1);
        Assertions.assertEquals(0, PaymentCalculator.overdueDays(due, LocalDate.of(2025, 2, 20)));
        Assertions.assertEquals(0, PaymentCalculator.overdueDays(due, due));
        Assertions.assertEquals(10, PaymentCalculator.overdueDays(due, LocalDate.of(2025, 3, 11)));
    }

    @Test
    void lateFeeChargesPerStartedWeek() {
        Money amount = Money.of("2000.00");
        Assertions.assertEquals(Money.ZERO, PaymentCalculator.lateFee(amount, 0));
        Assertions.assertEquals(Money.of("20.00"), PaymentCalculator.lateFee(amount, 1));
        Assertions.assertEquals(Money.of("20.00"), PaymentCalculator.lateFee(amount, 7));
        Assertions.assertEquals(Money.of("40.00"), PaymentCalculator.lateFee(amount, 10));
    }

    @Test
    void lateFeeIsCappedAtTenPercent() {
        Assertions.assertEquals(Money.of("200.00"), PaymentCalculator.lateFee(Money.of("2000.00"), 70));
        Assertions.assertEquals(Money.of("200.00"), PaymentCalculator.lateFee(Money.of("2000.00"), 400));
    }

    @Test
    void singlePayNeedsOnlyPositiveTotal() {
        Assertions.assertTrue(PaymentCalculator.validatePaymentSelection(
                Money.of("5000.00"), PaymentMethod.SINGLE_PAY, null, null, MIN).isEmpty());
        Assertions.assertEquals(1, PaymentCalculator.validatePaymentSelection(
                Money.ZERO, PaymentMethod.SINGLE_PAY, null, null, MIN).size());
    }

    @Test
    void bnplCollectsAllProblemsAtOnce() {
        List<String> errors = PaymentCalculator.validatePaymentSelection(
                Money.of("1000.00"), PaymentMethod.BNPL, Money.of("1000.00"), 30, MIN);

        Assertions.assertEquals(3, errors.size());
        Assertions.assertTrue(errors.stream().anyMatch(e -> e.contains("between 3 and 24")));
        Assertions.assertTrue(errors.stream().anyMatch(e -> e.contains("less than total")));
        Assertions.assertTrue(errors.stream().anyMatch(e -> e.contains("below the minimum")));
    }

    @Test
    void bnplReportsLowInstallmentAlongsideCountError() {
        List<String> errors = PaymentCalculator.validatePaymentSelection(
                Money.of("200.00"), PaymentMethod.BNPL, Money.ZERO, 30, MIN);

        Assertions.assertEquals(2, errors.size());
        Assertions.assertTrue(errors.stream().anyMatch(e -> e.contains("between 3 and 24")));
        Assertions.assertTrue(errors.stream().anyMatch(e -> e.startsWith("Monthly installment 6.66")));
    }

    @Test
    void bnplRequiresInstallmentCount() {
        List<String> errors = PaymentCalculator.validatePaymentSelection(
                Money.of("1000.00"), PaymentMethod.BNPL, null, null, MIN);
        Assertions.assertEquals(List.of("Number of installments is required for BNPL"), errors);
    }

    @Test
    void bnplRejectsInstallmentBelowMinimum() {
        List<String> errors = PaymentCalculator.validatePaymentSelection(
                Money.of("500.00"), PaymentMethod.BNPL, Money.ZERO, 6, MIN);

        Assertions.assertEquals(1, errors.size());
        Assertions.assertTrue(errors.get(0).startsWith("Monthly installment 83.33"));
    }

    @Test
    void referenceCarriesPrefixAndRandomSuffix() {
        Instant now = Instant.parse("2025-03-01T10:00:00Z");
        String a = PaymentCalculator.generateReference("BNPL", now);
        String b = PaymentCalculator.generateReference("BNPL", now);

        Assertions.assertTrue(a.matches("BNPL-[0-9A-Z]+-[0-9A-Z]{6}"), a);
        Assertions.assertNotEquals(a, b);
    }
}
