package com.example.compliance.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.compliance.orchestrator.dao.DispatchRecordDao;
import com.example.compliance.orchestrator.dao.ValidationSessionRepository;
import com.example.compliance.orchestrator.entity.ValidationSessionEntity;
import com.example.compliance.orchestrator.exception.DispatchException;
import com.example.compliance.orchestrator.model.DeliveryStatus;
import com.example.compliance.orchestrator.model.DispatchPayload;
import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.util.RetryPolicy;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;

class ValidationDispatcherTest {

  private final ValidationWorkflowClient workflowClient = mock(ValidationWorkflowClient.class);
  private final DispatchRecordDao dispatchRecordDao = mock(DispatchRecordDao.class);
  private final ValidationSessionRepository sessionRepository = mock(ValidationSessionRepository.class);
  private final SessionLifecycleService lifecycle = mock(SessionLifecycleService.class);
  private final ValidationDispatcher dispatcher = new ValidationDispatcher(
      workflowClient,
      dispatchRecordDao,
      sessionRepository,
      lifecycle,
      new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(2)),
      new SyncTaskExecutor(),
      mock(PlatformTransactionManager.class));

  @BeforeEach
  void setUp() {
    ValidationSessionEntity session = new ValidationSessionEntity()
        .setId(9L)
        .setUnitCode("BSB50420")
        .setStatus(SessionStatus.DISPATCHED)
        .setExpectedResultCount(12);
    when(sessionRepository.findById(9L)).thenReturn(Optional.of(session));
  }

  @Test
  void deliversPayloadAndMarksSessionValidating() {
    when(dispatchRecordDao.claimForDelivery(9L)).thenReturn(true);

    boolean delivered = dispatcher.dispatch(9L);

    assertThat(delivered).isTrue();
    verify(workflowClient).startValidation(new DispatchPayload(9L, 12));
    verify(dispatchRecordDao).markDelivered(eq(9L), any(Instant.class));
    verify(lifecycle).markValidating(9L);
  }

  @Test
  void unclaimedRecordIsNotDelivered() {
    when(dispatchRecordDao.claimForDelivery(9L)).thenReturn(false);

    assertThat(dispatcher.dispatch(9L)).isFalse();

    verify(workflowClient, never()).startValidation(any());
    verify(dispatchRecordDao, never()).findDeliveryStatus(anyLong());
  }

  @Test
  void retriedClaimThatFindsRecordDeliveringIsNotDeliveredAgain() {
    when(dispatchRecordDao.claimForDelivery(9L))
        .thenThrow(new QueryTimeoutException("commit acknowledgement lost"))
        .thenReturn(false);
    when(dispatchRecordDao.findDeliveryStatus(9L)).thenReturn(Optional.of(DeliveryStatus.DELIVERING));

    assertThat(dispatcher.dispatch(9L)).isFalse();

    verify(dispatchRecordDao, times(2)).claimForDelivery(9L);
    verify(dispatchRecordDao).findDeliveryStatus(9L);
    verify(workflowClient, never()).startValidation(any());
    verify(lifecycle, never()).markValidating(anyLong());
  }

  @Test
  void rejectedCallFailsSessionWithoutRetrying() {
    when(dispatchRecordDao.claimForDelivery(9L)).thenReturn(true);
    doThrow(new DispatchException("HTTP 400", false)).when(workflowClient).startValidation(any());

    assertThat(dispatcher.dispatch(9L)).isFalse();

    verify(workflowClient, times(1)).startValidation(any());
    verify(dispatchRecordDao).markFailed(eq(9L), startsWith("Failed to start validation workflow"));
    verify(lifecycle).failDispatch(eq(9L), startsWith("Failed to start validation workflow"));
    verify(lifecycle, never()).markValidating(anyLong());
  }

  @Test
  void unreachableWorkflowIsRetried() {
    when(dispatchRecordDao.claimForDelivery(9L)).thenReturn(true);
    doThrow(new DispatchException("connection refused", true))
        .doNothing()
        .when(workflowClient).startValidation(any());

    assertThat(dispatcher.dispatch(9L)).isTrue();

    verify(workflowClient, times(2)).startValidation(any());
    verify(lifecycle).markValidating(9L);
  }

  @Test
  void asyncDispatchFailureDoesNotReachCaller() {
    when(dispatchRecordDao.claimForDelivery(9L)).thenThrow(new IllegalStateException("boom"));

    dispatcher.dispatchAsync(9L);

    verify(workflowClient, never()).startValidation(any());
  }
}
