package com.opsdashboard.infrastructure.persistence.repository;

import com.opsdashboard.infrastructure.persistence.entity.TransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, Long>,
        JpaSpecificationExecutor<TransactionEntity> {

    @Query("SELECT DISTINCT t.category FROM TransactionEntity t")
    List<String> findDistinctCategories();

    @Query("SELECT DISTINCT t.status FROM TransactionEntity t")
    List<String> findDistinctStatuses();
}
