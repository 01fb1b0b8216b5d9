package com.paywise.budget.repository;

import com.paywise.budget.entity.TransactionEntity;
import com.paywise.budget.model.Transaction;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

@Repository
public class PostgreSQLTransactionRepository implements TransactionRepository {

    private final JpaTransactionRepository jpaTransactionRepository;

    public PostgreSQLTransactionRepository(JpaTransactionRepository jpaTransactionRepository) {
        this.jpaTransactionRepository = jpaTransactionRepository;
    }

    @Override
    public List<Transaction> findByDateRange(LocalDate fromInclusive, LocalDate toInclusive) {
        if (toInclusive.isBefore(fromInclusive)) {
            return List.of();
        }
        return jpaTransactionRepository.findByDateRange(fromInclusive, toInclusive).stream()
                .map(this::toModel)
                .toList();
    }

    private Transaction toModel(TransactionEntity entity) {
        return new Transaction(
                entity.getId(),
                entity.getOccurredOn(),
                entity.getCategoryId(),
                entity.getAmount(),
                entity.getName(),
                Optional.ofNullable(entity.getNotes())
        );
    }
}
