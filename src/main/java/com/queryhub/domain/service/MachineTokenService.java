package com.queryhub.domain.service;

import com.queryhub.infrastructure.persistence.entity.MachineTokenEntity;
import com.queryhub.infrastructure.persistence.repository.MachineTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * Validates MCP bearer tokens. Tokens are minted elsewhere; only their
 * SHA-256 hash is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MachineTokenService {

    private final MachineTokenRepository repository;
    private final Clock clock;

    /**
     * @return the workspace the token is bound to, if the token is known,
     * unrevoked and unexpired
     */
    @Transactional(readOnly = true)
    public Optional<String> resolveWorkspace(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return Optional.empty();
        }
        Optional<MachineTokenEntity> token = repository.findByTokenHash(QueryHasher.sha256Hex(rawToken.trim()));
        if (token.isEmpty()) {
            log.debug("Unknown machine token");
            return Optional.empty();
        }
        if (!token.get().isValidAt(clock.instant())) {
            log.info("Rejected revoked or expired machine token for client {}", token.get().getClientName());
            return Optional.empty();
        }
        return Optional.of(token.get().getWorkspaceId());
    }
}
