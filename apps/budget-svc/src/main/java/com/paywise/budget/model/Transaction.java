package com.paywise.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Ledger entry. {@code categoryId} is null for unassigned transactions; {@code amount}
 * is signed but the stored sign convention for expenses is not reliable.
 */
public record Transaction(
        Long id,
        LocalDate date,
        Long categoryId,
        BigDecimal amount,
        String name,
        Optional<String> notes
) {
    public Transaction {
        if (date == null) {
            throw new IllegalArgumentException("transaction date must be provided");
        }
        if (amount == null) {
            throw new IllegalArgumentException("transaction amount must be provided");
        }
        if (notes == null) {
            notes = Optional.empty();
        }
    }

    public BigDecimal magnitude() {
        return amount.abs();
    }

    public Transaction withAmount(BigDecimal newAmount) {
        return new Transaction(
                id,
                date,
                categoryId,
                newAmount,
                name,
                notes
        );
    }
}
