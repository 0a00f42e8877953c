package com.example.compliance.orchestrator.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import com.example.compliance.orchestrator.entity.DispatchRecordEntity;
import com.example.compliance.orchestrator.exception.SessionNotFoundException;
import com.example.compliance.orchestrator.model.DeliveryStatus;
import com.example.compliance.orchestrator.model.DispatchAudit;
import com.example.compliance.orchestrator.model.OperationTally;
import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import com.example.compliance.orchestrator.response.DispatchStatusResponse;
import com.example.compliance.orchestrator.response.ErrorResponse;
import com.example.compliance.orchestrator.service.DispatchAuditService;
import com.example.compliance.orchestrator.service.SessionLifecycleService;
import com.example.compliance.orchestrator.service.StatusPublisher;
import com.example.compliance.orchestrator.service.ValidationOrchestrator;
import com.example.compliance.orchestrator.sse.StatusEventMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

class SessionControllerTest {

  private final StatusPublisher statusPublisher = mock(StatusPublisher.class);
  private final DispatchAuditService dispatchAuditService = mock(DispatchAuditService.class);
  private final SessionController controller = new SessionController(
      mock(SessionLifecycleService.class),
      statusPublisher,
      mock(ValidationOrchestrator.class),
      dispatchAuditService,
      new StatusEventMapper(),
      new OrchestratorProperties());

  @Test
  void streamFramesSnapshotsAsStatusEvents() {
    SessionStatusSnapshot snapshot = SessionStatusSnapshot.builder()
        .sessionId(8L)
        .status(SessionStatus.VALIDATING)
        .lastUpdatedAt(Instant.now())
        .revision(4L)
        .build();
    when(statusPublisher.subscribe(8L)).thenReturn(Flux.just(snapshot).concatWith(Flux.never()));

    ServerSentEvent<?> first = controller.stream(8L).blockFirst(Duration.ofSeconds(5));

    assertThat(first).isNotNull();
    assertThat(first.event()).isEqualTo("status");
    assertThat(first.id()).isEqualTo("4");
    assertThat(first.data()).isEqualTo(snapshot);
  }

  @Test
  void streamOfUnknownSessionEndsWithErrorEvent() {
    when(statusPublisher.subscribe(99L)).thenReturn(Flux.error(new SessionNotFoundException(99L)));

    ServerSentEvent<?> event = controller.stream(99L).blockFirst(Duration.ofSeconds(5));

    assertThat(event).isNotNull();
    assertThat(event.event()).isEqualTo("error");
    assertThat(event.data()).isInstanceOf(ErrorResponse.class);
    assertThat(((ErrorResponse) event.data()).code()).isEqualTo("SESSION_NOT_FOUND");
  }

  @Test
  void undispatchedSessionReportsOperationProgressOnly() {
    when(dispatchAuditService.getDispatchStatus(8L))
        .thenReturn(new DispatchAudit(8L, new OperationTally(3, 1, 0), Optional.empty()));

    DispatchStatusResponse response = controller.dispatch(8L);

    assertThat(response.dispatched()).isFalse();
    assertThat(response.pendingOperations()).isEqualTo(2);
    assertThat(response.deliveryStatus()).isNull();
  }

  @Test
  void dispatchRecordIsExposed() {
    DispatchRecordEntity record = new DispatchRecordEntity()
        .setSessionId(8L)
        .setDeliveryStatus(DeliveryStatus.DELIVERED)
        .setAttemptCount(1)
        .setDispatchedAt(Instant.now());
    when(dispatchAuditService.getDispatchStatus(8L))
        .thenReturn(new DispatchAudit(8L, new OperationTally(2, 2, 0), Optional.of(record)));

    DispatchStatusResponse response = controller.dispatch(8L);

    assertThat(response.dispatched()).isTrue();
    assertThat(response.deliveryStatus()).isEqualTo(DeliveryStatus.DELIVERED);
    assertThat(response.attemptCount()).isEqualTo(1);
    assertThat(response.completedOperations()).isEqualTo(2);
  }
}
