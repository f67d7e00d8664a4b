package com.github.dimitryivaniuta.solar.payments.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-point monetary amount in minor units (two fraction digits).
 *
 * <p>Every amount handled by the service (calculator, entities, API mapping) goes through this type,
 * so the rounding policy lives in one place and floating point never touches money.</p>
 *
 * @param minorUnits amount in minor units (e.g. halalas)
 */
public record Money(long minorUnits) implements Comparable<Money> {

    /** Number of fraction digits of every amount. */
    public static final int SCALE = 2;

    /** Zero. */
    public static final Money ZERO = new Money(0L);

    /**
     * Creates an amount from minor units.
     *
     * @param minorUnits minor units
     * @return money
     */
    public static Money ofMinor(long minorUnits) {
        return new Money(minorUnits);
    }

    /**
     * Normalizes a decimal amount.
     *
     * @param amount decimal amount with at most two fraction digits
     * @return money
     * @throws IllegalArgumentException if the amount has more than two fraction digits
     */
    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        BigDecimal scaled;
        try {
            scaled = amount.setScale(SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount " + amount.toPlainString() + " has more than " + SCALE + " fraction digits", e);
        }
        return new Money(scaled.unscaledValue().longValueExact());
    }

    /**
     * Parses a decimal string such as {@code "2000.00"}.
     *
     * @param amount decimal string
     * @return money
     */
    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    /**
     * Null-tolerant variant of {@link #of(BigDecimal)}.
     *
     * @param amount decimal or null
     * @return money or null
     */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? null : of(amount);
    }

    public Money plus(Money other) {
        return new Money(Math.addExact(minorUnits, other.minorUnits));
    }

    public Money minus(Money other) {
        return new Money(Math.subtractExact(minorUnits, other.minorUnits));
    }

    public Money times(long factor) {
        return new Money(Math.multiplyExact(minorUnits, factor));
    }

    /**
     * Divides and truncates towards negative infinity at minor-unit precision.
     *
     * @param divisor positive divisor
     * @return floor(this / divisor)
     */
    public Money divideFloor(int divisor) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("divisor must be positive");
        }
        return new Money(Math.floorDiv(minorUnits, divisor));
    }

    /**
     * Applies a whole percentage, rounding half-up to minor units.
     *
     * @param percent percentage (e.g. 2 for 2%)
     * @return rounded share
     */
    public Money percent(int percent) {
        BigDecimal share = BigDecimal.valueOf(minorUnits)
                .multiply(BigDecimal.valueOf(percent))
                .divide(BigDecimal.valueOf(100L), 0, RoundingMode.HALF_UP);
        return new Money(share.longValueExact());
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return minorUnits == 0L;
    }

    public boolean isPositive() {
        return minorUnits > 0L;
    }

    public boolean isNegative() {
        return minorUnits < 0L;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public boolean isAtLeast(Money other) {
        return compareTo(other) >= 0;
    }

    /**
     * Decimal representation with exactly two fraction digits.
     *
     * @return decimal amount
     */
    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(minorUnits, SCALE);
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(minorUnits, other.minorUnits);
    }

    @Override
    public String toString() {
        return toDecimal().toPlainString();
    }
}
