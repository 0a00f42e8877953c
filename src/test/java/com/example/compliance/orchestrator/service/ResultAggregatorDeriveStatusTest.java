package com.example.compliance.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.compliance.orchestrator.model.ResultTally;
import com.example.compliance.orchestrator.model.SessionStatus;
import org.junit.jupiter.api.Test;

class ResultAggregatorDeriveStatusTest {

  @Test
  void noResultsAfterResultsArrivedIsPending() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.IN_PROGRESS, 5, false, ResultTally.empty());

    assertThat(status).isEqualTo(SessionStatus.PENDING);
  }

  @Test
  void noResultsKeepsDispatchStatesWhileResultsAreOutstanding() {
    assertThat(ResultAggregator.deriveStatus(SessionStatus.VALIDATING, 5, false, ResultTally.empty()))
        .isEqualTo(SessionStatus.VALIDATING);
    assertThat(ResultAggregator.deriveStatus(SessionStatus.DISPATCHED, null, false, ResultTally.empty()))
        .isEqualTo(SessionStatus.DISPATCHED);
  }

  @Test
  void zeroExpectedResultsSettlesToPending() {
    assertThat(ResultAggregator.deriveStatus(SessionStatus.VALIDATING, 0, false, ResultTally.empty()))
        .isEqualTo(SessionStatus.PENDING);
    assertThat(ResultAggregator.deriveStatus(SessionStatus.DISPATCHED, 0, false, ResultTally.empty()))
        .isEqualTo(SessionStatus.PENDING);
  }

  @Test
  void submissionWithoutAnyResultIsPending() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.VALIDATING, 5, true, ResultTally.empty());

    assertThat(status).isEqualTo(SessionStatus.PENDING);
  }

  @Test
  void noResultsKeepsStatesBeforeDispatch() {
    assertThat(ResultAggregator.deriveStatus(SessionStatus.INDEXING, 0, true, ResultTally.empty()))
        .isEqualTo(SessionStatus.INDEXING);
  }

  @Test
  void fewerResultsThanExpectedIsInProgress() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.VALIDATING, 5, false, new ResultTally(3, 3, 0, 0));

    assertThat(status).isEqualTo(SessionStatus.IN_PROGRESS);
  }

  @Test
  void unknownExpectedCountStaysInProgress() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.VALIDATING, null, false, new ResultTally(2, 2, 0, 0));

    assertThat(status).isEqualTo(SessionStatus.IN_PROGRESS);
  }

  @Test
  void allExpectedAndMetIsCompleted() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.IN_PROGRESS, 2, false, new ResultTally(2, 2, 0, 0));

    assertThat(status).isEqualTo(SessionStatus.COMPLETED);
  }

  @Test
  void anyUnmetResultMakesItPartial() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.IN_PROGRESS, 5, false, new ResultTally(5, 4, 0, 1));

    assertThat(status).isEqualTo(SessionStatus.PARTIAL);
  }

  @Test
  void submittedWithMissingResultsIsPartial() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.IN_PROGRESS, 5, true, new ResultTally(3, 3, 0, 0));

    assertThat(status).isEqualTo(SessionStatus.PARTIAL);
  }

  @Test
  void failedSessionsStayFailed() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.FAILED, 1, false, new ResultTally(1, 1, 0, 0));

    assertThat(status).isEqualTo(SessionStatus.FAILED);
  }

  @Test
  void completedCanReopenWhenAResultChanges() {
    SessionStatus status = ResultAggregator.deriveStatus(
        SessionStatus.COMPLETED, 2, false, new ResultTally(2, 1, 1, 0));

    assertThat(status).isEqualTo(SessionStatus.PARTIAL);
  }
}
