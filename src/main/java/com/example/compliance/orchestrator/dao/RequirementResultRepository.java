package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.entity.RequirementResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RequirementResultRepository extends JpaRepository<RequirementResultEntity, Long> {

    Optional<RequirementResultEntity> findBySessionIdAndRequirementId(Long sessionId, String requirementId);

    List<RequirementResultEntity> findBySessionIdOrderByRequirementIdAsc(Long sessionId);
}
