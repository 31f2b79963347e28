package com.queryhub.infrastructure.persistence.repository;

import com.queryhub.infrastructure.persistence.entity.AgentSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AgentSessionRepository extends JpaRepository<AgentSessionEntity, String> {
}
