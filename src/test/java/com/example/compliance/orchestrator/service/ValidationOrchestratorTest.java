package com.example.compliance.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.compliance.orchestrator.model.CompletionSummary;
import com.example.compliance.orchestrator.model.OperationStatus;
import com.example.compliance.orchestrator.model.OperationStatusChangedEvent;
import com.example.compliance.orchestrator.model.OperationTally;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationOrchestratorTest {

  private final CompletionDetector detector = mock(CompletionDetector.class);
  private final DispatchGuard guard = mock(DispatchGuard.class);
  private final ValidationDispatcher dispatcher = mock(ValidationDispatcher.class);
  private final SessionLifecycleService lifecycle = mock(SessionLifecycleService.class);
  private final ValidationOrchestrator orchestrator =
      new ValidationOrchestrator(detector, guard, dispatcher, lifecycle);

  @Test
  void failedOperationFailsSessionWithoutDispatch() {
    when(detector.evaluate(1L))
        .thenReturn(CompletionSummary.of(1L, new OperationTally(2, 1, 1), List.of(11L)));

    orchestrator.evaluateSession(1L);

    verify(lifecycle).failIndexing(1L, List.of(11L));
    verify(guard, never()).tryAcquireDispatch(anyLong());
  }

  @Test
  void allCompletedDispatchesOnceGuardIsAcquired() {
    when(detector.evaluate(1L)).thenReturn(CompletionSummary.of(1L, new OperationTally(2, 2, 0), List.of()));
    when(guard.tryAcquireDispatch(1L)).thenReturn(true);

    CompletionSummary summary = orchestrator.evaluateSession(1L);

    assertThat(summary.allDone()).isTrue();
    verify(dispatcher).dispatchAsync(1L);
  }

  @Test
  void lostGuardDoesNotDispatch() {
    when(detector.evaluate(1L)).thenReturn(CompletionSummary.of(1L, new OperationTally(2, 2, 0), List.of()));
    when(guard.tryAcquireDispatch(1L)).thenReturn(false);

    orchestrator.evaluateSession(1L);

    verify(dispatcher, never()).dispatchAsync(anyLong());
  }

  @Test
  void nonTerminalEventsAreIgnored() {
    orchestrator.onOperationStatusChanged(new OperationStatusChangedEvent(1L, 5L, OperationStatus.PROCESSING));

    verify(detector, never()).evaluate(anyLong());
  }

  @Test
  void evaluationFailureAfterCommitIsNotPropagated() {
    when(detector.evaluate(1L)).thenThrow(new IllegalStateException("db down"));

    orchestrator.onOperationStatusChanged(new OperationStatusChangedEvent(1L, 5L, OperationStatus.COMPLETED));

    verify(guard, never()).tryAcquireDispatch(anyLong());
  }
}
