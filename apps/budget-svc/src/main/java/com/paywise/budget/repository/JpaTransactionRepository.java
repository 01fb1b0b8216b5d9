package com.paywise.budget.repository;

import com.paywise.budget.entity.TransactionEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionRepository extends JpaRepository<TransactionEntity, Long> {

    @Query("SELECT t FROM TransactionEntity t WHERE t.occurredOn >= :from AND t.occurredOn <= :to ORDER BY t.occurredOn DESC, t.createdAt DESC")
    List<TransactionEntity> findByDateRange(@Param("from") LocalDate fromInclusive,
                                            @Param("to") LocalDate toInclusive);
}
