package com.payoutengine.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable value object representing a monetary amount with currency.
 * Amounts are always held at minor-unit precision (two decimals, HALF_UP),
 * so sums of rounded values never drift.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Money {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal amount;
    Currency currency;

    public static Money of(BigDecimal amount, Currency currency) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency cannot be null");
        }
        return new Money(amount.setScale(2, RoundingMode.HALF_UP), currency);
    }

    public static Money rub(BigDecimal amount) {
        return of(amount, Currency.RUB);
    }

    public static Money zero(Currency currency) {
        return of(BigDecimal.ZERO, currency);
    }

    public Money add(Money other) {
        validateSameCurrency(other);
        return new Money(this.amount.add(other.amount), this.currency);
    }

    public Money subtract(Money other) {
        validateSameCurrency(other);
        return new Money(this.amount.subtract(other.amount), this.currency);
    }

    /**
     * Percentage of this amount, rounded to minor units.
     */
    public Money percent(BigDecimal percent) {
        return of(this.amount.multiply(percent).divide(HUNDRED, 2, RoundingMode.HALF_UP), this.currency);
    }

    public boolean isPositive() {
        return this.amount.compareTo(BigDecimal.ZERO) > 0;
    }

    private void validateSameCurrency(Money other) {
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                String.format("Cannot perform operation on different currencies: %s and %s",
                    this.currency, other.currency)
            );
        }
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
