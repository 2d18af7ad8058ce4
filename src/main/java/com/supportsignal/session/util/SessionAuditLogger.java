package com.supportsignal.session.util;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Audit trail for session and impersonation events.
 *
 * Writes one line per event to the AUDIT logger (routed to its own appender
 * in logback-spring.xml) with the operation correlation id in MDC under
 * "auditCorrelationId". Persisting and searching the lines is the job of the
 * surrounding log pipeline.
 *
 * Callers must pass masked tokens only ({@link TokenGenerator#mask}).
 */
@Component
@RequiredArgsConstructor
public class SessionAuditLogger {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    static final String AUDIT_CORRELATION_MDC_KEY = "auditCorrelationId";

    private final MetricsHelper metricsHelper;

    /**
     * Starts an audit event.
     *
     * @param eventType event name, e.g. session_created
     * @param correlationId operation correlation id
     * @return builder collecting event attributes
     */
    public AuditEvent event(String eventType, String correlationId) {
        return new AuditEvent(eventType, correlationId);
    }

    public final class AuditEvent {

        private final String eventType;
        private final String correlationId;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private AuditEvent(String eventType, String correlationId) {
            this.eventType = eventType;
            this.correlationId = correlationId;
        }

        public AuditEvent with(String key, Object value) {
            if (value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public void success() {
            write(true);
        }

        public void failure(String error) {
            attributes.put("error", error);
            write(false);
        }

        private void write(boolean success) {
            String details = attributes.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));

            MDC.put(AUDIT_CORRELATION_MDC_KEY, correlationId);
            try {
                if (success) {
                    AUDIT.info("event={} correlationId={} {}", eventType, correlationId, details);
                } else {
                    AUDIT.warn("event={} correlationId={} outcome=failure {}", eventType, correlationId, details);
                }
            } finally {
                MDC.remove(AUDIT_CORRELATION_MDC_KEY);
            }

            metricsHelper.recordLifecycleEvent(eventType, success);
        }
    }
}
