package com.github.dimitryivaniuta.solar.payments.service;

import com.github.dimitryivaniuta.solar.payments.domain.InstallmentPlan;
import com.github.dimitryivaniuta.solar.payments.domain.Money;
import com.github.dimitryivaniuta.solar.payments.domain.PaymentMethod;
import com.github.dimitryivaniuta.solar.payments.exception.ValidationException;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Pure payment arithmetic: schedules, late fees, selection checks and references.
 *
 * <p>No I/O and no clock access; callers pass "today" and "now" explicitly.</p>
 */
public final class PaymentCalculator {

    public static final int MIN_INSTALLMENTS = 3;
    public static final int MAX_INSTALLMENTS = 24;

    /** Late fee percent charged per started week overdue. */
    public static final int LATE_FEE_PERCENT_PER_WEEK = 1;

    /** Late fee cap in percent of the installment. */
    public static final int LATE_FEE_MAX_PERCENT = 10;

    private static final String REFERENCE_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int REFERENCE_RANDOM_LENGTH = 6;
    private static final SecureRandom RANDOM = new SecureRandom();

    private PaymentCalculator() {
    }

    /**
     * Splits the financed principal into {@code n} monthly installments.
     *
     * <p>Installments 1..n-1 get {@code floor(principal / n)}; the last one absorbs the remainder, so the
     * installments plus the downpayment always add up to the total.</p>
     *
     * @param total       total amount
     * @param downpayment downpayment (zero allowed)
     * @param n           number of installments (3..24)
     * @param startDate   first due date is one month after this date
     * @return schedule
     * @throws ValidationException when the principal is negative or n is out of range
     */
    public static InstallmentPlan buildInstallmentSchedule(Money total, Money downpayment, int n, LocalDate startDate) {
        Money principal = total.minus(downpayment);
        if (principal.isNegative()) {
            throw new ValidationException("Downpayment cannot exceed total amount");
        }
        if (n < MIN_INSTALLMENTS || n > MAX_INSTALLMENTS) {
            throw new ValidationException("Number of installments must be between " + MIN_INSTALLMENTS + " and " + MAX_INSTALLMENTS);
        }
        Money emi = principal.divideFloor(n);
        List<InstallmentPlan.Item> items = new ArrayList<>(n);
        for (int i = 1; i < n; i++) {
            items.add(new InstallmentPlan.Item(i, emi, startDate.plusMonths(i)));
        }
        Money last = principal.minus(emi.times(n - 1L));
        items.add(new InstallmentPlan.Item(n, last, startDate.plusMonths(n)));
        return new InstallmentPlan(principal, emi, items);
    }

    /**
     * Whole days between the due date and today; zero when not yet due.
     *
     * @param dueDate due date
     * @param today   today in the service zone
     * @return overdue days
     */
    public static int overdueDays(LocalDate dueDate, LocalDate today) {
        long days = ChronoUnit.DAYS.between(dueDate, today);
        return (int) Math.max(0L, days);
    }

    /**
     * Late fee: 1% of the installment per started week overdue, at most 10%, rounded half-up.
     *
     * @param installmentAmount installment amount
     * @param overdueDays       days overdue
     * @return fee, zero when not overdue
     */
    public static Money lateFee(Money installmentAmount, int overdueDays) {
        if (overdueDays <= 0) {
            return Money.ZERO;
        }
        int weeks = (overdueDays + 6) / 7;
        int percent = Math.min(weeks * LATE_FEE_PERCENT_PER_WEEK, LATE_FEE_MAX_PERCENT);
        return installmentAmount.percent(percent);
    }

    /**
     * Checks a method selection and returns every problem found.
     *
     * @param total          total amount
     * @param method         chosen method
     * @param downpayment    downpayment or null
     * @param installments   number of installments or null
     * @param minInstallment smallest acceptable monthly installment
     * @return error messages, empty when valid
     */
    public static List<String> validatePaymentSelection(Money total, PaymentMethod method, Money downpayment,
                                                        Integer installments, Money minInstallment) {
        List<String> errors = new ArrayList<>();
        if (total == null || !total.isPositive()) {
            errors.add("Total amount must be positive");
            return errors;
        }
        if (method != PaymentMethod.BNPL) {
            return errors;
        }
        Money down = downpayment == null ? Money.ZERO : downpayment;
        if (installments == null) {
            errors.add("Number of installments is required for BNPL");
        } else if (installments < MIN_INSTALLMENTS || installments > MAX_INSTALLMENTS) {
            errors.add("Number of installments must be between " + MIN_INSTALLMENTS + " and " + MAX_INSTALLMENTS);
        }
        if (down.isNegative()) {
            errors.add("Downpayment cannot be negative");
        } else if (down.isAtLeast(total)) {
            errors.add("Downpayment must be less than total amount");
        }
        Money principal = total.minus(down);
        if (installments != null && installments > 0 && !down.isNegative() && !principal.isNegative()) {
            Money emi = principal.divideFloor(installments);
            if (emi.isLessThan(minInstallment)) {
                errors.add("Monthly installment " + emi + " is below the minimum of " + minInstallment);
            }
        }
        return errors;
    }

    /**
     * Builds a reference such as {@code BNPL-LX3K9Q2A-7F2K1Z}.
     *
     * @param prefix reference prefix
     * @param now    current instant
     * @return unique reference
     */
    public static String generateReference(String prefix, Instant now) {
        StringBuilder sb = new StringBuilder(prefix.length() + 24)
                .append(prefix)
                .append('-')
                .append(Long.toString(now.toEpochMilli(), 36).toUpperCase(Locale.ROOT))
                .append('-');
        for (int i = 0; i < REFERENCE_RANDOM_LENGTH; i++) {
            sb.append(REFERENCE_ALPHABET.charAt(RANDOM.nextInt(REFERENCE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
