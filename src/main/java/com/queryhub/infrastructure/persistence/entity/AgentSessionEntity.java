package com.queryhub.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Agent session, owned by the agent runtime. Read here only to map a
 * session id to its workspace.
 */
@Entity
@Table(name = "agent_sessions", indexes = {
        @Index(name = "idx_agent_session_workspace", columnList = "workspace_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSessionEntity {

    @Id
    @Column(name = "session_id", length = 64)
    private String sessionId;

    @Column(name = "workspace_id", nullable = false, length = 64)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private SessionStatus status = SessionStatus.CREATED;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public enum SessionStatus {
        CREATED,
        RUNNING,
        COMPLETED,
        FAILED,
        CLOSED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CLOSED;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
