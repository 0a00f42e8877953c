package com.example.compliance.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.compliance.orchestrator.dao.DispatchRecordDao;
import com.example.compliance.orchestrator.dao.SessionAggregateDao;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.model.OperationTally;
import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatus;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;

class DispatchGuardTest {

  private final DispatchRecordDao dispatchRecordDao = mock(DispatchRecordDao.class);
  private final ValidationSessionRepository sessionRepository = mock(ValidationSessionRepository.class);
  private final SessionAggregateDao aggregateDao = mock(SessionAggregateDao.class);
  private final ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);
  private final DispatchGuard guard = new DispatchGuard(
      dispatchRecordDao, sessionRepository, aggregateDao, eventPublisher, mock(PlatformTransactionManager.class));

  private ValidationSessionEntity session(SessionStatus status) {
    ValidationSessionEntity session = new ValidationSessionEntity().setId(3L).setUnitCode("BSB50420").setStatus(status);
    when(sessionRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(session));
    when(aggregateDao.tallyOperations(3L)).thenReturn(new OperationTally(2, 2, 0));
    return session;
  }

  @Test
  void firstCallerAcquiresAndMarksSessionDispatched() {
    ValidationSessionEntity session = session(SessionStatus.INDEXING);

    assertThat(guard.tryAcquireDispatch(3L)).isTrue();

    assertThat(session.getStatus()).isEqualTo(SessionStatus.DISPATCHED);
    assertThat(session.getRevision()).isEqualTo(1L);
    verify(dispatchRecordDao).insertPending(eq(3L), any(Instant.class));
    verify(eventPublisher).publishEvent(any(SessionStateChangedEvent.class));
  }

  @Test
  void duplicateRecordMeansAlreadyDispatched() {
    session(SessionStatus.INDEXING);
    doThrow(new DuplicateKeyException("uq_dispatch_records_session"))
        .when(dispatchRecordDao).insertPending(eq(3L), any(Instant.class));

    assertThat(guard.tryAcquireDispatch(3L)).isFalse();
  }

  @Test
  void otherInsertFailuresAreTreatedAsNotAcquired() {
    session(SessionStatus.INDEXING);
    doThrow(new DataIntegrityViolationException("fk"))
        .when(dispatchRecordDao).insertPending(eq(3L), any(Instant.class));

    assertThat(guard.tryAcquireDispatch(3L)).isFalse();
  }

  @Test
  void sessionPastIndexingIsNotDispatchable() {
    session(SessionStatus.VALIDATING);

    assertThat(guard.tryAcquireDispatch(3L)).isFalse();

    verify(dispatchRecordDao, never()).insertPending(anyLong(), any());
  }

  @Test
  void operationRegisteredAfterCompletionCheckBlocksDispatch() {
    ValidationSessionEntity session = session(SessionStatus.INDEXING);
    when(aggregateDao.tallyOperations(3L)).thenReturn(new OperationTally(2, 1, 0));

    assertThat(guard.tryAcquireDispatch(3L)).isFalse();

    assertThat(session.getStatus()).isEqualTo(SessionStatus.INDEXING);
    verify(dispatchRecordDao, never()).insertPending(anyLong(), any());
  }

  @Test
  void failedOperationUnderLockBlocksDispatch() {
    session(SessionStatus.INDEXING);
    when(aggregateDao.tallyOperations(3L)).thenReturn(new OperationTally(2, 1, 1));

    assertThat(guard.tryAcquireDispatch(3L)).isFalse();

    verify(dispatchRecordDao, never()).insertPending(anyLong(), any());
  }
}
