package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.model.SessionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ValidationSessionRepository extends JpaRepository<ValidationSessionEntity, Long> {

    /**
     * Loads the session row with a write lock held until the surrounding transaction ends.
     * Every writer of a session's derived fields goes through this, so concurrent writers for the
     * same session queue up at the database instead of overwriting each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from ValidationSessionEntity s where s.id = :id")
    Optional<ValidationSessionEntity> findByIdForUpdate(@Param("id") Long id);

    List<ValidationSessionEntity> findByStatusInAndLastUpdatedAtBeforeOrderByLastUpdatedAtAsc(
            Collection<SessionStatus> statuses, Instant cutoff, Pageable pageable);

    List<ValidationSessionEntity> findByStatusInOrderByLastUpdatedAtAsc(
            Collection<SessionStatus> statuses, Pageable pageable);
}
