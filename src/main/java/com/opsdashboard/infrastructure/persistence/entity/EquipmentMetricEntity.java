package com.opsdashboard.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One telemetry reading (temperature, load, pressure...) of one piece of equipment.
 */
@Entity
@Table(name = "equipment_metrics", indexes = {
    @Index(name = "idx_metric_measured_at", columnList = "measured_at"),
    @Index(name = "idx_metric_equipment", columnList = "equipment_id"),
    @Index(name = "idx_metric_name", columnList = "metric_name"),
    @Index(name = "idx_metric_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentMetricEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "measured_at", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "equipment_id", nullable = false, length = 50)
    private String equipmentId;

    @Column(name = "metric_name", nullable = false, length = 50)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private Double value;

    @Column(length = 20)
    private String unit;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = "normal";
}
