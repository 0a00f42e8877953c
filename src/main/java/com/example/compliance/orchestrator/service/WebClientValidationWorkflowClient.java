package com.example.compliance.orchestrator.service;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import com.example.compliance.orchestrator.exception.DispatchException;
import com.example.compliance.orchestrator.model.DispatchPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
public class WebClientValidationWorkflowClient implements ValidationWorkflowClient {

    /** Answers that mean the request was not processed and may be sent again. */
    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 502, 503, 504);

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientValidationWorkflowClient(@Qualifier("validationWorkflowWebClient") WebClient webClient,
                                             OrchestratorProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.getDispatch().getTimeout();
    }

    @Override
    public void startValidation(DispatchPayload payload) {
        try {
            webClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
            log.debug("[dispatcher] Workflow acknowledged session {}", payload.sessionId());
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new DispatchException("Validation workflow answered HTTP %d for session %d"
                    .formatted(status, payload.sessionId()), RETRYABLE_STATUSES.contains(status), e);
        } catch (WebClientRequestException e) {
            throw new DispatchException("Validation workflow unreachable: " + e.getMessage(), true, e);
        } catch (RuntimeException e) {
            // a timeout leaves it unknown whether the workflow started, so it is not retried
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new DispatchException("Validation workflow did not answer within " + timeout, false, e);
            }
            throw e;
        }
    }
}
