package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.entity.IndexingOperationEntity;
import com.example.compliance.orchestrator.model.OperationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IndexingOperationRepository extends JpaRepository<IndexingOperationEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from IndexingOperationEntity o where o.id = :id")
    Optional<IndexingOperationEntity> findByIdForUpdate(@Param("id") Long id);

    List<IndexingOperationEntity> findBySessionIdOrderByIdAsc(Long sessionId);

    @Query("""
        SELECT o.id
        FROM IndexingOperationEntity o
        WHERE o.sessionId = :sessionId AND o.status = :status
        ORDER BY o.id
        """)
    List<Long> findIdsBySessionIdAndStatus(
            @Param("sessionId") Long sessionId,
            @Param("status") OperationStatus status
    );
}
