package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.entity.DispatchRecordEntity;
import com.example.compliance.orchestrator.model.DeliveryStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface DispatchRecordRepository extends JpaRepository<DispatchRecordEntity, Long> {

    Optional<DispatchRecordEntity> findBySessionId(Long sessionId);

    boolean existsBySessionId(Long sessionId);

    List<DispatchRecordEntity> findByDeliveryStatusAndDispatchedAtBeforeOrderByDispatchedAtAsc(
            DeliveryStatus deliveryStatus, Instant cutoff, Pageable pageable);

    /**
     * Only the manual retry path may call this; nothing automatic ever removes the witness.
     */
    @Modifying
    @Query("DELETE FROM DispatchRecordEntity d WHERE d.sessionId = :sessionId")
    int deleteBySessionId(@Param("sessionId") Long sessionId);
}
