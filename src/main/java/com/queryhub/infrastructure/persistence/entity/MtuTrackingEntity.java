package com.queryhub.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Daily MTU snapshot for billing. One row per workspace and day.
 */
@Entity
@Table(name = "mtu_tracking",
        uniqueConstraints = @UniqueConstraint(name = "uq_mtu_workspace_date",
                columnNames = {"workspace_id", "tracking_date"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MtuTrackingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Column(name = "tracking_date", nullable = false)
    private LocalDate trackingDate;

    @Column(name = "mtu_count", nullable = false)
    private long mtuCount;

    @Column(name = "source", nullable = false, length = 30)
    private String source;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
