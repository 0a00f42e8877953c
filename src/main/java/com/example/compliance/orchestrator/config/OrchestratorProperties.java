package com.example.compliance.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "orchestrator")
@Validated
public class OrchestratorProperties {

    private final Dispatch dispatch = new Dispatch();
    private final Retry retry = new Retry();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Stream stream = new Stream();

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Retry getRetry() {
        return retry;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public Stream getStream() {
        return stream;
    }

    public static final class Dispatch {
        private String webhookUrl = "http://localhost:5678/webhook/validate-document";
        private Duration timeout = Duration.ofSeconds(10);
        /** Worker threads delivering dispatches; 0 delivers on the calling thread. */
        private int executorThreads = 4;
        private boolean outboxEnabled = true;
        private Duration outboxInterval = Duration.ofSeconds(30);
        private Duration outboxGrace = Duration.ofSeconds(15);
        private int outboxBatchSize = 50;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getExecutorThreads() {
            return executorThreads;
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = executorThreads;
        }

        public boolean isOutboxEnabled() {
            return outboxEnabled;
        }

        public void setOutboxEnabled(boolean outboxEnabled) {
            this.outboxEnabled = outboxEnabled;
        }

        public Duration getOutboxInterval() {
            return outboxInterval;
        }

        public void setOutboxInterval(Duration outboxInterval) {
            this.outboxInterval = outboxInterval;
        }

        public Duration getOutboxGrace() {
            return outboxGrace;
        }

        public void setOutboxGrace(Duration outboxGrace) {
            this.outboxGrace = outboxGrace;
        }

        public int getOutboxBatchSize() {
            return outboxBatchSize;
        }

        public void setOutboxBatchSize(int outboxBatchSize) {
            this.outboxBatchSize = outboxBatchSize;
        }
    }

    public static final class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static final class Reconciliation {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(1);
        private Duration stuckTimeout = Duration.ofMinutes(10);
        private Duration indexingGrace = Duration.ofMinutes(2);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getStuckTimeout() {
            return stuckTimeout;
        }

        public void setStuckTimeout(Duration stuckTimeout) {
            this.stuckTimeout = stuckTimeout;
        }

        public Duration getIndexingGrace() {
            return indexingGrace;
        }

        public void setIndexingGrace(Duration indexingGrace) {
            this.indexingGrace = indexingGrace;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static final class Stream {
        private Duration heartbeat = Duration.ofSeconds(15);

        public Duration getHeartbeat() {
            return heartbeat;
        }

        public void setHeartbeat(Duration heartbeat) {
            this.heartbeat = heartbeat;
        }
    }
}
