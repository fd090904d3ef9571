package com.opsdashboard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Financial transaction (revenue, payments, refunds).
 *
 * Indexing Strategy:
 * - Index on date for range filters and time bucketing
 * - Indexes on category and status for equality filters and distinct lookups
 * - Index on customerId for list lookups
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "idx_transaction_date", columnList = "transaction_date"),
    @Index(name = "idx_transaction_category", columnList = "category"),
    @Index(name = "idx_transaction_status", columnList = "status"),
    @Index(name = "idx_transaction_customer", columnList = "customer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_date", nullable = false)
    private LocalDateTime date;

    @Column(nullable = false, length = 50)
    private String category;

    @Column(nullable = false)
    private Double amount;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = "completed";

    @Column(length = 255)
    private String description;

    @Column(name = "customer_id", length = 50)
    private String customerId;
}
