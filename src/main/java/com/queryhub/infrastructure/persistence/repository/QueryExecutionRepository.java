package com.queryhub.infrastructure.persistence.repository;

import com.queryhub.infrastructure.persistence.entity.QueryExecutionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface QueryExecutionRepository extends JpaRepository<QueryExecutionEntity, String> {
}
