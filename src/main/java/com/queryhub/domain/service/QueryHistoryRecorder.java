package com.queryhub.domain.service;

import com.queryhub.domain.error.QueryException;
import com.queryhub.domain.error.QueryTimeoutException;
import com.queryhub.domain.model.ExecutionStatus;
import com.queryhub.domain.model.IssuedBy;
import com.queryhub.infrastructure.persistence.entity.QueryExecutionEntity;
import com.queryhub.infrastructure.persistence.entity.QueryExecutionEntity.ExecutionState;
import com.queryhub.infrastructure.persistence.repository.QueryExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes the {@code query_executions} history. Only the hash and the outcome are
 * kept, never the query text.
 *
 * History is best effort: a failed write is logged and the query carries on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryHistoryRecorder {

    private final QueryExecutionRepository repository;
    private final Clock clock;

    /**
     * Records a running execution and returns its query id.
     */
    public String start(String workspaceId, String queryHash, IssuedBy issuedBy) {
        String queryId = UUID.randomUUID().toString();
        Instant now = clock.instant();
        try {
            QueryExecutionEntity execution = QueryExecutionEntity.builder()
                    .queryId(queryId)
                    .workspaceId(workspaceId)
                    .queryHash(queryHash)
                    .issuedBy(issuedBy)
                    .createdAt(now)
                    .build();
            execution.markStarted(now);
            repository.save(execution);
        } catch (Exception e) {
            log.warn("Could not record start of query {} for workspace {}: {}", queryId, workspaceId, e.getMessage());
        }
        return queryId;
    }

    public void complete(String queryId, ExecutionStatus status, int rowCount) {
        try {
            repository.findById(queryId).ifPresent(execution -> {
                execution.markCompleted(
                        status == ExecutionStatus.PARTIAL ? ExecutionState.PARTIAL : ExecutionState.COMPLETED,
                        rowCount,
                        clock.instant());
                repository.save(execution);
            });
        } catch (Exception e) {
            log.warn("Could not record completion of query {}: {}", queryId, e.getMessage());
        }
    }

    public void fail(String queryId, Throwable error) {
        ExecutionState state = error instanceof QueryTimeoutException ? ExecutionState.TIMEOUT : ExecutionState.FAILED;
        String errorKind = error instanceof QueryException
                ? ((QueryException) error).getKind().getCode()
                : "internal_error";
        try {
            repository.findById(queryId).ifPresent(execution -> {
                execution.markFailed(state, errorKind, clock.instant());
                repository.save(execution);
            });
        } catch (Exception e) {
            log.warn("Could not record failure of query {}: {}", queryId, e.getMessage());
        }
    }
}
