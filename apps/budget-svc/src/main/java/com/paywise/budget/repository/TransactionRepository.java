package com.paywise.budget.repository;

import com.paywise.budget.model.Transaction;
import java.time.LocalDate;
import java.util.List;

public interface TransactionRepository {

    /**
     * Transactions dated within {@code [fromInclusive, toInclusive]}, uncategorised ones included,
     * newest first.
     */
    List<Transaction> findByDateRange(LocalDate fromInclusive, LocalDate toInclusive);
}
