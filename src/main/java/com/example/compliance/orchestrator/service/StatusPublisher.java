package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.model.SessionStateChangedEvent;
import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves session snapshots to dashboards, as a single read or as a live stream. Snapshots are
 * emitted only after the transaction that produced them committed, and a subscriber never sees a
 * revision older than one it already received.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusPublisher {

    private final SessionLifecycleService lifecycleService;

    private final ConcurrentMap<Long, Channel> channels = new ConcurrentHashMap<>();

    public SessionStatusSnapshot getStatus(long sessionId) {
        return lifecycleService.snapshot(sessionId);
    }

    /**
     * Streams snapshots of one session. The first element is the current committed state; updates
     * committed while that read is in flight are not lost because the live channel is joined first.
     */
    public Flux<SessionStatusSnapshot> subscribe(long sessionId) {
        return Flux.defer(() -> {
            Channel channel = join(sessionId);
            AtomicLong lastRevision = new AtomicLong(-1);
            Mono<SessionStatusSnapshot> current = Mono.fromCallable(() -> getStatus(sessionId))
                    .subscribeOn(Schedulers.boundedElastic());

            return Flux.merge(channel.sink.asFlux().onBackpressureLatest(), current)
                    .filter(snapshot -> advance(lastRevision, snapshot.getRevision()))
                    .doFinally(signal -> leave(sessionId, channel));
        });
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSessionStateChanged(SessionStateChangedEvent event) {
        Channel channel = channels.get(event.sessionId());
        if (channel == null) {
            return;
        }
        Sinks.EmitResult result;
        synchronized (channel) {
            result = channel.sink.tryEmitNext(event.snapshot());
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[publisher] Snapshot r{} of session {} not emitted: {}",
                    event.snapshot().getRevision(), event.sessionId(), result);
        }
    }

    public int activeSubscriptions() {
        return channels.values().stream().mapToInt(channel -> channel.subscribers).sum();
    }

    private Channel join(long sessionId) {
        return channels.compute(sessionId, (id, existing) -> {
            Channel channel = existing == null ? new Channel() : existing;
            channel.subscribers++;
            return channel;
        });
    }

    private void leave(long sessionId, Channel channel) {
        channels.computeIfPresent(sessionId, (id, existing) -> {
            if (existing != channel) {
                return existing;
            }
            existing.subscribers--;
            if (existing.subscribers > 0) {
                return existing;
            }
            existing.sink.tryEmitComplete();
            log.debug("[publisher] Last subscriber of session {} left", sessionId);
            return null;
        });
    }

    private static boolean advance(AtomicLong lastRevision, long revision) {
        long seen = lastRevision.get();
        while (revision > seen) {
            if (lastRevision.compareAndSet(seen, revision)) {
                return true;
            }
            seen = lastRevision.get();
        }
        return false;
    }

    private static final class Channel {
        final Sinks.Many<SessionStatusSnapshot> sink = Sinks.many().multicast().directBestEffort();
        volatile int subscribers;
    }
}
