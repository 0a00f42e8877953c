package com.example.compliance.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.compliance.orchestrator.dao.IndexingOperationRepository;
import com.example.compliance.orchestrator.dao.SessionAggregateDao;
import com.example.compliance.orchestrator.model.CompletionSummary;
import com.example.compliance.orchestrator.model.OperationStatus;
import com.example.compliance.orchestrator.model.OperationTally;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompletionDetectorTest {

  private final SessionAggregateDao aggregateDao = mock(SessionAggregateDao.class);
  private final IndexingOperationRepository operationRepository = mock(IndexingOperationRepository.class);
  private final CompletionDetector detector = new CompletionDetector(aggregateDao, operationRepository);

  @Test
  void allCompletedIsDoneWithoutFailures() {
    when(aggregateDao.tallyOperations(7L)).thenReturn(new OperationTally(3, 3, 0));

    CompletionSummary summary = detector.evaluate(7L);

    assertThat(summary.allDone()).isTrue();
    assertThat(summary.anyFailed()).isFalse();
    verify(operationRepository, never()).findIdsBySessionIdAndStatus(anyLong(), any());
  }

  @Test
  void runningOperationKeepsSessionOpen() {
    when(aggregateDao.tallyOperations(7L)).thenReturn(new OperationTally(3, 2, 0));

    CompletionSummary summary = detector.evaluate(7L);

    assertThat(summary.allDone()).isFalse();
    assertThat(summary.pending()).isEqualTo(1);
  }

  @Test
  void failedOperationsAreListed() {
    when(aggregateDao.tallyOperations(7L)).thenReturn(new OperationTally(3, 1, 1));
    when(operationRepository.findIdsBySessionIdAndStatus(7L, OperationStatus.FAILED)).thenReturn(List.of(42L));

    CompletionSummary summary = detector.evaluate(7L);

    assertThat(summary.allDone()).isFalse();
    assertThat(summary.anyFailed()).isTrue();
    assertThat(summary.failedOperationIds()).containsExactly(42L);
  }
}
