package com.example.compliance.orchestrator.sse;

import com.example.compliance.orchestrator.model.SessionStatusSnapshot;
import com.example.compliance.orchestrator.response.ErrorResponse;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

/**
 * Frames session snapshots for the status stream. The event id is the snapshot revision, so a
 * client can tell which state it saw last.
 */
@Component
public class StatusEventMapper {

    public static final String STATUS_EVENT = "status";
    public static final String ERROR_EVENT = "error";

    public ServerSentEvent<?> toStatusEvent(SessionStatusSnapshot snapshot) {
        return ServerSentEvent.builder(snapshot)
                .id(String.valueOf(snapshot.getRevision()))
                .event(STATUS_EVENT)
                .build();
    }

    public ServerSentEvent<?> heartbeat() {
        return ServerSentEvent.builder()
                .comment("keep-alive")
                .build();
    }

    public ServerSentEvent<?> toErrorEvent(String code, String message) {
        return ServerSentEvent.builder(ErrorResponse.of(code, message))
                .event(ERROR_EVENT)
                .build();
    }
}
