package com.example.compliance.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatus;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

class StatusPublisherTest {

  private final SessionLifecycleService lifecycle = mock(SessionLifecycleService.class);
  private final StatusPublisher publisher = new StatusPublisher(lifecycle);

  private static SessionStatusSnapshot snapshot(long revision, SessionStatus status, int observed, int met) {
    return SessionStatusSnapshot.builder()
        .sessionId(4L)
        .status(status)
        .observedCount(observed)
        .expectedCount(5)
        .metCount(met)
        .progressPercent(observed == 0 ? 0 : Math.round(met * 100f / observed))
        .lastUpdatedAt(Instant.now())
        .revision(revision)
        .build();
  }

  @Test
  void currentSnapshotComesFirstAndStaleRevisionsAreDropped() throws InterruptedException {
    when(lifecycle.snapshot(4L)).thenReturn(snapshot(2, SessionStatus.VALIDATING, 0, 0));
    List<SessionStatusSnapshot> received = new CopyOnWriteArrayList<>();
    CountDownLatch first = new CountDownLatch(1);
    CountDownLatch all = new CountDownLatch(3);

    Disposable subscription = publisher.subscribe(4L).subscribe(snapshot -> {
      received.add(snapshot);
      first.countDown();
      all.countDown();
    });
    assertThat(first.await(5, TimeUnit.SECONDS)).isTrue();

    publisher.onSessionStateChanged(new SessionStateChangedEvent(snapshot(5, SessionStatus.IN_PROGRESS, 3, 2)));
    publisher.onSessionStateChanged(new SessionStateChangedEvent(snapshot(4, SessionStatus.IN_PROGRESS, 2, 2)));
    publisher.onSessionStateChanged(new SessionStateChangedEvent(snapshot(6, SessionStatus.PARTIAL, 5, 4)));

    assertThat(all.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(received).extracting(SessionStatusSnapshot::getRevision).containsExactly(2L, 5L, 6L);
    assertThat(received.get(2).getProgressPercent()).isEqualTo(80);
    subscription.dispose();
  }

  @Test
  void subscriptionsAreCountedUntilCancelled() throws InterruptedException {
    when(lifecycle.snapshot(4L)).thenReturn(snapshot(1, SessionStatus.PENDING, 0, 0));
    CountDownLatch received = new CountDownLatch(2);

    Disposable a = publisher.subscribe(4L).subscribe(snapshot -> received.countDown());
    Disposable b = publisher.subscribe(4L).subscribe(snapshot -> received.countDown());
    assertThat(received.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(publisher.activeSubscriptions()).isEqualTo(2);

    a.dispose();
    b.dispose();

    assertThat(publisher.activeSubscriptions()).isZero();
  }

  @Test
  void eventsWithoutSubscribersAreDiscarded() {
    publisher.onSessionStateChanged(new SessionStateChangedEvent(snapshot(3, SessionStatus.COMPLETED, 5, 5)));

    assertThat(publisher.activeSubscriptions()).isZero();
  }
}
