package com.queryhub.infrastructure.persistence.entity;

import com.queryhub.domain.model.IssuedBy;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History row for one remote query execution. Query text is never stored.
 */
@Entity
@Table(name = "query_executions", indexes = {
        @Index(name = "idx_exec_workspace_created", columnList = "workspace_id, created_at"),
        @Index(name = "idx_exec_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryExecutionEntity {

    @Id
    @Column(name = "query_id", length = 64)
    private String queryId;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Column(name = "query_hash", nullable = false, length = 64)
    private String queryHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "issued_by", nullable = false, length = 20)
    private IssuedBy issuedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private ExecutionState status = ExecutionState.PENDING;

    @Column(name = "error_kind", length = 50)
    private String errorKind;

    @Column(name = "row_count")
    private Integer rowCount;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public enum ExecutionState {
        PENDING,
        RUNNING,
        COMPLETED,
        PARTIAL,
        FAILED,
        TIMEOUT
    }

    public void markStarted(Instant now) {
        this.status = ExecutionState.RUNNING;
        this.startedAt = now;
    }

    public void markCompleted(ExecutionState state, int rowCount, Instant now) {
        this.status = state;
        this.rowCount = rowCount;
        this.completedAt = now;
        this.executionTimeMs = elapsed();
    }

    public void markFailed(ExecutionState state, String errorKind, Instant now) {
        this.status = state;
        this.errorKind = errorKind;
        this.completedAt = now;
        this.executionTimeMs = elapsed();
    }

    private Long elapsed() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
