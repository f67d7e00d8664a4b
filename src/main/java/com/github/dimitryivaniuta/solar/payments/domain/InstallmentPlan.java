package com.github.dimitryivaniuta.solar.payments.domain;

import java.time.LocalDate;
import java.util.List;

/**
 * Computed BNPL schedule, before it is persisted.
 *
 * @param principal    total minus downpayment
 * @param monthlyEmi   regular monthly installment
 * @param installments installments ordered by number (the last one absorbs rounding)
 */
public record InstallmentPlan(Money principal, Money monthlyEmi, List<Item> installments) {

    public InstallmentPlan {
        installments = List.copyOf(installments);
    }

    /**
     * Sum of all installment amounts; always equals {@link #principal()}.
     *
     * @return sum
     */
    public Money sum() {
        return installments.stream().map(Item::amount).reduce(Money.ZERO, Money::plus);
    }

    /**
     * One planned installment.
     *
     * @param number  1-based installment number
     * @param amount  amount due
     * @param dueDate due date
     */
    public record Item(int number, Money amount, LocalDate dueDate) {}
}
