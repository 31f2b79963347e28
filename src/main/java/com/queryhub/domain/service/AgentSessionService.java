package com.queryhub.domain.service;

import com.queryhub.domain.error.ResourceNotFoundException;
import com.queryhub.infrastructure.persistence.entity.AgentSessionEntity;
import com.queryhub.infrastructure.persistence.repository.AgentSessionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class AgentSessionService {

    private final AgentSessionRepository repository;

    /**
     * Returns the workspace an open agent session belongs to.
     */
    @Transactional(readOnly = true)
    public String resolveWorkspace(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ResourceNotFoundException("Agent session not found");
        }
        AgentSessionEntity session = repository.findById(sessionId)
                .orElseThrow(() -> new ResourceNotFoundException("Agent session not found"));
        if (session.getStatus().isTerminal()) {
            throw new ResourceNotFoundException("Agent session is " + session.getStatus().name().toLowerCase(Locale.ROOT));
        }
        return session.getWorkspaceId();
    }
}
